package com.workstream.core.exception;

/**
 * Thrown when a (name, version) contract pair already exists.
 */
public class DuplicateVersionException extends WorkstreamException {

    public static final String ERROR_CODE = "DUPLICATE_CONTRACT_VERSION";

    public DuplicateVersionException(String contractName, String version) {
        super(ERROR_CODE, String.format("Contract %s already has version %s", contractName, version));
    }
}
