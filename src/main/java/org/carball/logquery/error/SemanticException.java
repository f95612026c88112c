package org.carball.logquery.error;

/**
 * Well-formed input that cannot be compiled: operator/value mismatch, malformed
 * relative time, or an operator the target field does not support.
 */
public class SemanticException extends QueryBuildException {

    public SemanticException(String message) {
        super(message);
    }
}
