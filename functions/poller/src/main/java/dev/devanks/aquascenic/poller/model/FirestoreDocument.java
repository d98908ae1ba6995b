package dev.devanks.aquascenic.poller.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL) // A patch body carries only fields
@JsonIgnoreProperties(ignoreUnknown = true)
public class FirestoreDocument {

    private String name; // projects/.../documents/pools/{poolId}

    private Map<String, TypedValue> fields;

    private String createTime;

    private String updateTime;
}
