package dao.ore.bmine.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import dao.ore.bmine.TestFixtures;
import dao.ore.bmine.config.MinerProperties;
import dao.ore.bmine.model.Identity;
import dao.ore.bmine.util.CryptoUtil;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IdentityLoaderTest {

    @TempDir
    Path folder;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MinerProperties minerProps;
    private IdentityLoader loader;

    @BeforeEach
    void setUp() {
        minerProps = TestFixtures.minerProperties(10_000);
        minerProps.setKeyFolder(folder.toString());
        loader = new IdentityLoader(minerProps, TestFixtures.oreProgram(), objectMapper);
    }

    @Test
    void identities_readsJsonFilesInNameOrder() throws Exception {
        byte[] first = keypair("b");
        byte[] second = keypair("a");
        write("id-2.json", second);
        write("id-1.json", first);
        Files.writeString(folder.resolve("notes.txt"), "ignored");

        List<Identity> identities = loader.identities();

        assertEquals(2, identities.size());
        assertArrayEquals(Arrays.copyOfRange(first, 32, 64), identities.get(0).publicKey().toBytes());
        assertArrayEquals(Arrays.copyOfRange(second, 32, 64), identities.get(1).publicKey().toBytes());
        assertEquals(TestFixtures.oreProgram().proofAddress(identities.get(0).publicKey()),
                identities.get(0).proofAddress());
        assertSame(identities, loader.identities());
    }

    @Test
    void identities_mismatchedPublicKeyFails() throws Exception {
        byte[] bytes = keypair("c");
        bytes[40] ^= 1;
        write("bad.json", bytes);

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> loader.identities());
        assertTrue(e.getMessage().contains("mismatched"));
    }

    @Test
    void identities_wrongLengthFails() throws Exception {
        Files.writeString(folder.resolve("short.json"), "[1,2,3]");

        assertThrows(IllegalStateException.class, () -> loader.identities());
    }

    @Test
    void identities_emptyFolderFails() {
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> loader.identities());
        assertTrue(e.getMessage().contains("no keypairs"));
    }

    @Test
    void identities_unsetFolderFails() {
        minerProps.setKeyFolder(" ");

        assertThrows(IllegalStateException.class, () -> loader.identities());
    }

    private static byte[] keypair(String label) {
        byte[] seed = CryptoUtil.sha256(label.getBytes(StandardCharsets.UTF_8));
        byte[] pub = new Ed25519PrivateKeyParameters(seed, 0).generatePublicKey().getEncoded();
        byte[] bytes = new byte[64];
        System.arraycopy(seed, 0, bytes, 0, 32);
        System.arraycopy(pub, 0, bytes, 32, 32);
        return bytes;
    }

    private void write(String name, byte[] bytes) throws Exception {
        int[] values = new int[bytes.length];
        for (int i = 0; i < bytes.length; i++) {
            values[i] = Byte.toUnsignedInt(bytes[i]);
        }
        objectMapper.writeValue(folder.resolve(name).toFile(), values);
    }
}
