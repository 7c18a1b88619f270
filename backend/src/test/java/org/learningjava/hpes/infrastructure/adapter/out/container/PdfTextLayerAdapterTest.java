package org.learningjava.hpes.infrastructure.adapter.out.container;

import org.junit.jupiter.api.Test;
import org.learningjava.hpes.domain.model.InputDecodeException;
import org.learningjava.hpes.domain.model.TextLayer;
import org.learningjava.hpes.testsupport.Containers;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PdfTextLayerAdapterTest {

    private final PdfTextLayerAdapter adapter = new PdfTextLayerAdapter();

    @Test
    void supports_by_name_mime_or_magic() {
        assertTrue(adapter.supports("paper.pdf", null, new byte[0]));
        assertTrue(adapter.supports("x", "application/pdf", new byte[0]));
        assertTrue(adapter.supports("x", null, "%PDF-1.7\n".getBytes(StandardCharsets.US_ASCII)));
        assertFalse(adapter.supports("x.txt", "text/plain", "PDF".getBytes(StandardCharsets.US_ASCII)));
    }

    @Test
    void extracts_text_lines() throws Exception {
        byte[] pdf = Containers.pdf(List.of("int main(void) {", "return 0;", "}"), false);

        TextLayer layer = adapter.extract(pdf);

        assertEquals("pdf", layer.format());
        String text = layer.text();
        assertTrue(text.contains("int main(void) {"));
        assertTrue(text.indexOf("int main") < text.indexOf("return 0;"));
        assertFalse(text.contains("\r"));
        assertEquals(0, layer.skippedObjects());
    }

    @Test
    void counts_images_as_skipped_objects() throws Exception {
        TextLayer layer = adapter.extract(Containers.pdf(List.of("figure"), true));
        assertEquals(1, layer.skippedObjects());
    }

    @Test
    void garbage_is_a_decode_failure() {
        byte[] bytes = "%PDF-1.4\nnot really".getBytes(StandardCharsets.US_ASCII);
        assertThrows(InputDecodeException.class, () -> adapter.extract(bytes));
    }
}
