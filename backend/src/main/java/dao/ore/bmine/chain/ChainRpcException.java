package dao.ore.bmine.chain;

/**
 * Transient failure of a ledger query: network, timeout, RPC error or undecodable response.
 */
public class ChainRpcException extends RuntimeException {

    public ChainRpcException(String message) {
        super(message);
    }

    public ChainRpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
