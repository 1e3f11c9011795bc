package vn.com.fecredit.fileportal.model.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChecksumUtilTest {

    private static final String ABC_SHA256 = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

    @TempDir
    Path tempDir;

    @Test
    void sha256Hex_knownVector() {
        assertEquals(ABC_SHA256, ChecksumUtil.sha256Hex("abc".getBytes(StandardCharsets.US_ASCII)));
    }

    @Test
    void sha256Hex_fileMatchesBytes() throws Exception {
        byte[] data = new byte[200_000];
        for (int i = 0; i < data.length; i++) {
            data[i] = (byte) (i * 31);
        }
        Path file = tempDir.resolve("data.bin");
        Files.write(file, data);
        assertEquals(ChecksumUtil.sha256Hex(data), ChecksumUtil.sha256Hex(file));
    }

    @Test
    void hexToBase64_knownVector() {
        assertEquals("ungWv48Bz+pBQUDeXa4iI7ADYaOWF3qctBD/YfIAFa0=", ChecksumUtil.hexToBase64(ABC_SHA256));
    }

    @Test
    void fromHex_decodesBothCases() {
        assertArrayEquals(new byte[]{(byte) 0xba, 0x78, 0x16}, ChecksumUtil.fromHex("BA7816"));
        assertEquals(ABC_SHA256, ChecksumUtil.toHex(ChecksumUtil.fromHex(ABC_SHA256)));
        assertThrows(IllegalArgumentException.class, () -> ChecksumUtil.fromHex("abc"));
    }

    @Test
    void matches_isCaseInsensitiveAndNullSafe() {
        assertTrue(ChecksumUtil.matches(ABC_SHA256.toUpperCase(), ABC_SHA256));
        assertFalse(ChecksumUtil.matches(null, ABC_SHA256));
        assertFalse(ChecksumUtil.matches(ABC_SHA256, null));
    }
}
