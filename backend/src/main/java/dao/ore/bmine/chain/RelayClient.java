package dao.ore.bmine.chain;

import dao.ore.bmine.model.Bundle;

public interface RelayClient {

    /**
     * Submits the bundle as one atomic relay unit.
     *
     * @return the relay's opaque bundle id
     * @throws RelayException when the relay rejects or cannot be reached
     */
    String sendBundle(Bundle bundle);
}
