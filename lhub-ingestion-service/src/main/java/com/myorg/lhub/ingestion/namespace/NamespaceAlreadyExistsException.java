package com.myorg.lhub.ingestion.namespace;

public class NamespaceAlreadyExistsException extends RuntimeException {
    public NamespaceAlreadyExistsException(String name) {
        super("Namespace '" + name + "' already exists");
    }
}
