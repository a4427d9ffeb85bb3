package com.workstream.core.exception;

/**
 * Thrown when a contract name, or a specific version of it, is not registered.
 */
public class UnknownContractException extends WorkstreamException {

    public static final String ERROR_CODE = "UNKNOWN_CONTRACT";

    public UnknownContractException(String contractName) {
        super(ERROR_CODE, String.format("Contract not registered: %s", contractName));
    }

    public UnknownContractException(String contractName, String version) {
        super(ERROR_CODE, String.format("Contract %s has no version %s", contractName, version));
    }
}
