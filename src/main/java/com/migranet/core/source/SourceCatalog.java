package com.migranet.core.source;

import com.migranet.core.model.MigrationObject;

/**
 * Source-side catalog: DDL and code extraction.
 */
public interface SourceCatalog {

    /** @throws ConnectivityException when the source database is unreachable */
    void ping();

    /**
     * Full source definition of the object.
     *
     * @return definition text, or empty when the object has none
     */
    String fetchDefinition(MigrationObject object) throws Exception;
}
