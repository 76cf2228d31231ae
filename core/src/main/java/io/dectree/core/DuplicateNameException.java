// file: core/src/main/java/io/dectree/core/DuplicateNameException.java
package io.dectree.core;

/** Thrown when an ingestion batch contains the same address twice. */
public class DuplicateNameException extends RuntimeException {
    private final String name;

    public DuplicateNameException(String name) {
        super("duplicate node name: " + name);
        this.name = name;
    }

    public String name() {
        return name;
    }
}
