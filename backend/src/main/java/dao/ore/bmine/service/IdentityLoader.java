package dao.ore.bmine.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import dao.ore.bmine.chain.OreProgram;
import dao.ore.bmine.config.MinerProperties;
import dao.ore.bmine.model.Identity;
import dao.ore.bmine.model.PublicKey;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

/**
 * Loads identities from a folder of keypair files, each a JSON array of 64 byte values
 * (32-byte seed followed by the 32-byte public key). Files are read in name order so batches are stable.
 */
@Slf4j
@Service
public class IdentityLoader {

    private final MinerProperties minerProps;
    private final OreProgram ore;
    private final ObjectMapper objectMapper;

    private List<Identity> loaded;

    public IdentityLoader(MinerProperties minerProps, OreProgram ore, ObjectMapper objectMapper) {
        this.minerProps = minerProps;
        this.ore = ore;
        this.objectMapper = objectMapper;
    }

    /**
     * Identities from the configured key folder, read once and cached for the process lifetime.
     */
    public synchronized List<Identity> identities() {
        if (loaded == null) {
            loaded = List.copyOf(load());
        }
        return loaded;
    }

    List<Identity> load() {
        if (minerProps.getKeyFolder() == null || minerProps.getKeyFolder().isBlank()) {
            throw new IllegalStateException("miner.key-folder must be set");
        }
        List<Identity> identities = load(Path.of(minerProps.getKeyFolder()));
        if (identities.isEmpty()) {
            throw new IllegalStateException("no keypairs found in " + minerProps.getKeyFolder());
        }
        log.info("Loaded {} identities from {}", identities.size(), minerProps.getKeyFolder());
        return identities;
    }

    List<Identity> load(Path folder) {
        List<Path> files;
        try (Stream<Path> listing = Files.list(folder)) {
            files = listing.filter(p -> p.getFileName().toString().endsWith(".json")).sorted().toList();
        } catch (IOException e) {
            throw new IllegalStateException("cannot list key folder " + folder + ": " + e.getMessage(), e);
        }
        List<Identity> identities = new ArrayList<>(files.size());
        for (Path file : files) {
            identities.add(readKeypair(file));
        }
        return identities;
    }

    private Identity readKeypair(Path file) {
        int[] values;
        try {
            values = objectMapper.readValue(file.toFile(), int[].class);
        } catch (IOException e) {
            throw new IllegalStateException("invalid keypair file " + file + ": " + e.getMessage(), e);
        }
        if (values.length != 64) {
            throw new IllegalStateException("keypair file " + file + " holds " + values.length + " bytes, expected 64");
        }
        byte[] bytes = new byte[64];
        for (int i = 0; i < 64; i++) {
            bytes[i] = (byte) values[i];
        }
        Ed25519PrivateKeyParameters key = new Ed25519PrivateKeyParameters(bytes, 0);
        byte[] derived = key.generatePublicKey().getEncoded();
        if (!Arrays.equals(derived, Arrays.copyOfRange(bytes, 32, 64))) {
            throw new IllegalStateException("keypair file " + file + " has mismatched public key");
        }
        return new Identity(key, ore.proofAddress(new PublicKey(derived)));
    }
}
