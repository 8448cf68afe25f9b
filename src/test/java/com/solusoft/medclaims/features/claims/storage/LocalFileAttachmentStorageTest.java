package com.solusoft.medclaims.features.claims.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;

import com.solusoft.medclaims.config.MedClaimsProperties;
import com.solusoft.medclaims.exception.AttachmentStorageException;

public class LocalFileAttachmentStorageTest {

    private static final byte[] PDF = "%PDF-1.4\n1 0 obj\n<< /Type /Catalog >>\nendobj\n%%EOF\n"
            .getBytes(StandardCharsets.US_ASCII);

    private static final byte[] PNG = new byte[] {
            (byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n', 0, 0, 0, 0x0D, 'I', 'H', 'D', 'R' };

    @TempDir
    Path uploadRoot;

    private LocalFileAttachmentStorage storage;

    @BeforeEach
    public void setup() {
        MedClaimsProperties properties = new MedClaimsProperties();
        properties.getUploads().setDirectory(uploadRoot.toString());
        properties.getUploads().setMaxSizeBytes(1024);
        storage = new LocalFileAttachmentStorage(properties);
    }

    @Test
    public void testStore_pdf_isWrittenUnderRandomName() throws Exception {
        StoredFile stored = storage.store(new MockMultipartFile("attachment", "Invoice.PDF", "text/plain", PDF));

        assertEquals("Invoice.PDF", stored.originalName());
        assertEquals("application/pdf", stored.contentType());
        Path written = Path.of(stored.path());
        assertTrue(written.startsWith(uploadRoot.toAbsolutePath().normalize()));
        assertTrue(written.getFileName().toString().endsWith(".pdf"));
        assertFalse(written.getFileName().toString().startsWith("Invoice"));
        assertTrue(Files.exists(written));
    }

    @Test
    public void testStore_typeComesFromContentNotHeader() {
        StoredFile stored = storage.store(new MockMultipartFile("attachment", "scan.pdf", "application/pdf", PNG));

        assertEquals("image/png", stored.contentType());
    }

    @Test
    public void testStore_plainText_isBlocked() {
        MockMultipartFile text = new MockMultipartFile("attachment", "notes.pdf", "application/pdf",
                "just some notes".getBytes(StandardCharsets.UTF_8));

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> storage.store(text));
        assertTrue(ex.getMessage().startsWith("Security Block"));
        assertTrue(ex.getMessage().contains("text/plain"));
    }

    @Test
    public void testStore_oversizedFile_isBlocked() {
        byte[] big = new byte[2048];
        System.arraycopy(PDF, 0, big, 0, PDF.length);

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> storage.store(new MockMultipartFile("attachment", "big.pdf", "application/pdf", big)));
        assertTrue(ex.getMessage().startsWith("Security Block"));
    }

    @Test
    public void testStore_emptyFile_isRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> storage.store(new MockMultipartFile("attachment", "empty.pdf", "application/pdf", new byte[0])));
    }

    @Test
    public void testDelete_removesStoredFile() {
        StoredFile stored = storage.store(new MockMultipartFile("attachment", "invoice.pdf", "application/pdf", PDF));

        storage.delete(stored.path());

        assertFalse(Files.exists(Path.of(stored.path())));
    }

    @Test
    public void testDelete_outsideUploadRoot_isRefused() {
        String outside = uploadRoot.resolve("../elsewhere.pdf").toString();

        assertThrows(AttachmentStorageException.class, () -> storage.delete(outside));
    }

    @Test
    public void testIsAvailable_writableDirectory() {
        assertTrue(storage.isAvailable());
    }
}
