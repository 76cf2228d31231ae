// file: service/src/main/java/io/dectree/service/analysis/UpstreamFailureException.java
package io.dectree.service.analysis;

/** A completion backend failed (network, quota, malformed response, ...). */
public class UpstreamFailureException extends RuntimeException {
    public UpstreamFailureException(String message) {
        super(message);
    }

    public UpstreamFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
