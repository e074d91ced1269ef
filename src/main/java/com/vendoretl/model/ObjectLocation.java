package com.vendoretl.model;

import lombok.Builder;
import lombok.Value;

/**
 * Where an acknowledged upload ended up.
 */
@Value
@Builder
public class ObjectLocation {
    String bucket;
    String key;
    String eTag;
    // null unless bucket versioning is enabled
    String versionId;

    public String uri() {
        return "s3://" + bucket + "/" + key;
    }
}
