package com.migranet.core.metadata;

import com.migranet.core.memory.ObjectDescription;
import com.migranet.core.model.MigrationObject;

/**
 * Reads back the target-side shape of a freshly deployed object.
 */
public interface MetadataRefresher {

    ObjectDescription describe(MigrationObject object, String targetSchema) throws Exception;
}
