// file: service/src/main/java/io/dectree/service/ErrorKind.java
package io.dectree.service;

/** Failure categories reported by {@link NavResult.Failure}. */
public enum ErrorKind {
    NOT_FOUND,
    NO_CURRENT_NODE,
    NO_PARENT,
    DUPLICATE_NAME,
    INVALID_RANGE,
    VALIDATION_ERROR,
    UPSTREAM_FAILURE
}
