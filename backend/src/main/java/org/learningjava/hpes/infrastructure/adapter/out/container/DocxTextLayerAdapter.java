package org.learningjava.hpes.infrastructure.adapter.out.container;

import org.apache.poi.openxml4j.exceptions.OpenXML4JException;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFSDT;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.learningjava.hpes.application.port.TextLayerExtractorPort;
import org.learningjava.hpes.domain.model.InputDecodeException;
import org.learningjava.hpes.domain.model.TextLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Word documents: one line per paragraph and per table cell, in document order.
 * Pictures and embedded objects are counted and left out.
 */
@Component
public class DocxTextLayerAdapter implements TextLayerExtractorPort {

    private static final Logger log = LoggerFactory.getLogger(DocxTextLayerAdapter.class);

    static final String MIME = "application/vnd.openxmlformats-officedocument.wordprocessingml.document";
    private static final byte[] MAIN_PART = "word/document.xml".getBytes(StandardCharsets.US_ASCII);

    @Override
    public String format() {
        return "docx";
    }

    @Override
    public boolean supports(String fileName, String mimeType, byte[] content) {
        if (fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".docx")) {
            return true;
        }
        if (MIME.equals(mimeType)) {
            return true;
        }
        return isZip(content) && contains(content, MAIN_PART);
    }

    @Override
    public TextLayer extract(byte[] content) {
        try (XWPFDocument docx = new XWPFDocument(new ByteArrayInputStream(content))) {
            StringBuilder sb = new StringBuilder();
            int skipped = 0;
            for (IBodyElement element : docx.getBodyElements()) {
                if (element instanceof XWPFParagraph paragraph) {
                    sb.append(paragraph.getText()).append('\n');
                    for (XWPFRun run : paragraph.getRuns()) {
                        skipped += run.getEmbeddedPictures().size();
                    }
                } else if (element instanceof XWPFTable table) {
                    for (XWPFTableRow row : table.getRows()) {
                        for (XWPFTableCell cell : row.getTableCells()) {
                            sb.append(cell.getText()).append('\n');
                        }
                    }
                } else if (element instanceof XWPFSDT sdt) {
                    sb.append(sdt.getContent().getText()).append('\n');
                }
            }
            skipped += embeddedParts(docx);
            log.debug("DOCX text layer: {} chars, {} objects skipped", sb.length(), skipped);
            return new TextLayer(format(), sb.toString(), skipped);
        } catch (IOException | RuntimeException e) {
            throw new InputDecodeException("DOCX container could not be opened: " + e.getMessage(), e);
        }
    }

    private static int embeddedParts(XWPFDocument docx) {
        try {
            return docx.getAllEmbeddedParts().size();
        } catch (OpenXML4JException e) {
            log.warn("Could not list embedded parts: {}", e.getMessage());
            return 0;
        }
    }

    static boolean isZip(byte[] content) {
        return content.length >= 4 && content[0] == 'P' && content[1] == 'K' && content[2] == 3 && content[3] == 4;
    }

    private static boolean contains(byte[] haystack, byte[] needle) {
        outer:
        for (int i = 0; i <= haystack.length - needle.length; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (haystack[i + j] != needle[j]) {
                    continue outer;
                }
            }
            return true;
        }
        return false;
    }
}
