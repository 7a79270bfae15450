package org.dbsync.migration;

import org.dbsync.migration.spi.ValueTransformer;
import org.dbsync.migration.spi.dialect.DdlDialect;

import java.util.List;
import java.util.stream.Collectors;

public abstract class AbstractDialect implements DdlDialect {
    protected ValueTransformer valueTransformer;

    protected AbstractDialect() {
        this.valueTransformer = initializeValueTransformer();
    }

    protected abstract ValueTransformer initializeValueTransformer();
    public abstract String quoteIdentifier(String identifier);

    @Override
    public ValueTransformer getValueTransformer() {
        return this.valueTransformer;
    }

    protected String quoteAll(List<String> identifiers) {
        return identifiers.stream().map(this::quoteIdentifier).collect(Collectors.joining(", "));
    }
}
