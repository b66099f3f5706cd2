package com.myorg.lhub.ingestion.namespace;

public class NamespaceNotFoundException extends RuntimeException {
    public NamespaceNotFoundException(String name) {
        super("Namespace '" + name + "' not found");
    }
}
