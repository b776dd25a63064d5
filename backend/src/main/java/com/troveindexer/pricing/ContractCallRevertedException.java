package com.troveindexer.pricing;

import com.troveindexer.ingestion.adapter.RpcException;

/**
 * eth_call reached the node and the call reverted. {@link #getErrorData()} holds the ABI-encoded custom
 * error when the node returns one.
 */
class ContractCallRevertedException extends RpcException {

    ContractCallRevertedException(String message, Integer errorCode, String revertData) {
        super(message, errorCode, revertData);
    }
}
