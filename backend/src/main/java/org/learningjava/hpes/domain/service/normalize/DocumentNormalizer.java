package org.learningjava.hpes.domain.service.normalize;

import org.learningjava.hpes.application.port.TextLayerExtractorPort;
import org.learningjava.hpes.config.ExtractionProperties;
import org.learningjava.hpes.domain.model.ExtractionRequest;
import org.learningjava.hpes.domain.model.ExtractionWarning;
import org.learningjava.hpes.domain.model.InputDecodeException;
import org.learningjava.hpes.domain.model.NormalizationResult;
import org.learningjava.hpes.domain.model.SourceDocument;
import org.learningjava.hpes.domain.model.TextLayer;
import org.learningjava.hpes.domain.model.WarningKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns raw bytes into a {@link SourceDocument}: container text layers, BOM aware
 * decoding with replacement of bad sequences, NUL removal and line ending folding.
 */
@Component
public class DocumentNormalizer {

    private static final Logger log = LoggerFactory.getLogger(DocumentNormalizer.class);

    static final char REPLACEMENT = (char) 0xFFFD;

    private final List<TextLayerExtractorPort> containers;
    private final long maxInputBytes;

    public DocumentNormalizer(List<TextLayerExtractorPort> containers, ExtractionProperties props) {
        this.containers = List.copyOf(containers);
        this.maxInputBytes = props.getNormalize().getMaxInputBytes();
    }

    public NormalizationResult normalize(ExtractionRequest request) {
        byte[] bytes = request.content();
        String id = request.fileName();
        if (bytes.length > maxInputBytes) {
            throw new InputDecodeException(id + " is " + bytes.length + " bytes, above the limit of " + maxInputBytes);
        }
        if (bytes.length == 0) {
            return new NormalizationResult(new SourceDocument(id, ""), List.of());
        }

        List<ExtractionWarning> warnings = new ArrayList<>();
        Optional<TextLayerExtractorPort> container = containers.stream()
                .filter(c -> c.supports(request.fileName(), request.mimeType(), bytes))
                .findFirst();

        String text;
        int replaced;
        if (container.isPresent()) {
            TextLayer layer = container.get().extract(bytes);
            if (layer.skippedObjects() > 0) {
                warnings.add(ExtractionWarning.of(WarningKind.MALFORMED_CONTAINER,
                        id + ": skipped " + layer.skippedObjects() + " embedded binary objects in " + layer.format()));
                log.warn("Skipped {} embedded objects in {}", layer.skippedObjects(), id);
            }
            text = layer.text();
            replaced = 0;
        } else {
            Decoded decoded = decode(bytes);
            text = decoded.text();
            replaced = decoded.replaced();
        }

        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\r') {
                sb.append('\n');
                if (i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
            } else if (c == 0) {
                sb.append(REPLACEMENT);
                replaced++;
            } else {
                sb.append(c);
            }
        }
        String normalized = sb.toString();
        if (container.isEmpty() && !normalized.isEmpty() && countReplacements(normalized) == normalized.length()) {
            throw new InputDecodeException(id + " has no recoverable characters");
        }
        if (replaced > 0) {
            warnings.add(ExtractionWarning.of(WarningKind.DECODE,
                    id + ": replaced " + replaced + " undecodable or NUL characters"));
            log.warn("Replaced {} undecodable characters in {}", replaced, id);
        }
        return new NormalizationResult(new SourceDocument(id, normalized), warnings);
    }

    private record Decoded(String text, int replaced) {
    }

    static Decoded decode(byte[] bytes) {
        Charset charset = StandardCharsets.UTF_8;
        int offset = 0;
        if (bytes.length >= 3 && (bytes[0] & 0xFF) == 0xEF && (bytes[1] & 0xFF) == 0xBB && (bytes[2] & 0xFF) == 0xBF) {
            offset = 3;
        } else if (bytes.length >= 2 && (bytes[0] & 0xFF) == 0xFE && (bytes[1] & 0xFF) == 0xFF) {
            charset = StandardCharsets.UTF_16BE;
            offset = 2;
        } else if (bytes.length >= 2 && (bytes[0] & 0xFF) == 0xFF && (bytes[1] & 0xFF) == 0xFE) {
            charset = StandardCharsets.UTF_16LE;
            offset = 2;
        }

        CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        ByteBuffer in = ByteBuffer.wrap(bytes, offset, bytes.length - offset);
        CharBuffer out = CharBuffer.allocate(8192);
        StringBuilder sb = new StringBuilder(bytes.length);
        int replaced = 0;

        while (true) {
            CoderResult result = decoder.decode(in, out, true);
            if (result.isOverflow()) {
                drain(out, sb);
            } else if (result.isError()) {
                drain(out, sb);
                sb.append(REPLACEMENT);
                replaced++;
                in.position(in.position() + result.length());
            } else {
                break;
            }
        }
        while (decoder.flush(out).isOverflow()) {
            drain(out, sb);
        }
        drain(out, sb);
        return new Decoded(sb.toString(), replaced);
    }

    private static void drain(CharBuffer out, StringBuilder sb) {
        out.flip();
        sb.append(out);
        out.clear();
    }

    private static int countReplacements(String text) {
        int n = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == REPLACEMENT) {
                n++;
            }
        }
        return n;
    }
}
