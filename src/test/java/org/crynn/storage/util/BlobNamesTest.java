package org.crynn.storage.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BlobNamesTest {

    @Test
    void blobIdIsSha256Hex() {
        // sha256("abc")
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", BlobNames.blobId("abc"));
    }

    @Test
    void fileRefFansOutByFirstTwoHexChars() {
        String id = BlobNames.blobId("https://example.com/app.js");
        assertEquals(id.substring(0, 2) + "/" + id + ".bin", BlobNames.fileRef("https://example.com/app.js"));
    }

    @Test
    void sameKeyAlwaysMapsToSameFile() {
        assertEquals(BlobNames.fileRef("k"), BlobNames.fileRef("k"));
        assertNotEquals(BlobNames.fileRef("k1"), BlobNames.fileRef("k2"));
    }
}
