package com.migranet.testing;

import com.migranet.core.memory.ObjectDescription;
import com.migranet.core.memory.ObjectDescription.ColumnDescription;
import com.migranet.core.metadata.MetadataRefresher;
import com.migranet.core.model.MigrationObject;

import java.util.List;

/**
 * Describes every object as having an identity column ID and a NAME column.
 */
public class FakeMetadataRefresher implements MetadataRefresher {

    private boolean failing = false;

    public FakeMetadataRefresher failing() {
        this.failing = true;
        return this;
    }

    @Override
    public ObjectDescription describe(MigrationObject object, String targetSchema) {
        if (failing) {
            throw new IllegalStateException("metadata unavailable");
        }
        return new ObjectDescription(targetSchema, object.getName(), object.getKind(),
                List.of(new ColumnDescription("ID", "int", false, true),
                        new ColumnDescription("NAME", "varchar(50)", true, false)),
                List.of());
    }
}
