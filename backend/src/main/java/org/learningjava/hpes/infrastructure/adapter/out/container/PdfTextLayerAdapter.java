package org.learningjava.hpes.infrastructure.adapter.out.container;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentNameDictionary;
import org.apache.pdfbox.pdmodel.PDEmbeddedFilesNameTreeNode;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDResources;
import org.apache.pdfbox.text.PDFTextStripper;
import org.learningjava.hpes.application.port.TextLayerExtractorPort;
import org.learningjava.hpes.domain.model.InputDecodeException;
import org.learningjava.hpes.domain.model.TextLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Locale;

/** PDF text layer through the PDFBox text stripper; images and attachments are counted, not read. */
@Component
public class PdfTextLayerAdapter implements TextLayerExtractorPort {

    private static final Logger log = LoggerFactory.getLogger(PdfTextLayerAdapter.class);

    @Override
    public String format() {
        return "pdf";
    }

    @Override
    public boolean supports(String fileName, String mimeType, byte[] content) {
        if (fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
            return true;
        }
        if ("application/pdf".equals(mimeType)) {
            return true;
        }
        return content.length >= 5 && content[0] == '%' && content[1] == 'P' && content[2] == 'D'
                && content[3] == 'F' && content[4] == '-';
    }

    @Override
    public TextLayer extract(byte[] content) {
        try (PDDocument pdf = Loader.loadPDF(content)) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            stripper.setLineSeparator("\n");
            String text = stripper.getText(pdf);
            int skipped = countImages(pdf) + countAttachments(pdf);
            log.debug("PDF text layer: {} pages, {} chars, {} objects skipped",
                    pdf.getNumberOfPages(), text.length(), skipped);
            return new TextLayer(format(), text, skipped);
        } catch (IOException | RuntimeException e) {
            throw new InputDecodeException("PDF container could not be opened: " + e.getMessage(), e);
        }
    }

    private static int countImages(PDDocument pdf) throws IOException {
        int images = 0;
        for (PDPage page : pdf.getPages()) {
            PDResources resources = page.getResources();
            if (resources == null) {
                continue;
            }
            for (COSName name : resources.getXObjectNames()) {
                if (resources.isImageXObject(name)) {
                    images++;
                }
            }
        }
        return images;
    }

    private static int countAttachments(PDDocument pdf) throws IOException {
        PDDocumentNameDictionary names = pdf.getDocumentCatalog().getNames();
        if (names == null) {
            return 0;
        }
        PDEmbeddedFilesNameTreeNode files = names.getEmbeddedFiles();
        if (files == null || files.getNames() == null) {
            return 0;
        }
        return files.getNames().size();
    }
}
