package com.production.scholar_service.service.extraction;

import com.production.scholar_service.model.DocumentFormat;
import com.production.scholar_service.model.ExtractedContent;
import com.production.scholar_service.model.PageContent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * UTF-8, falling back to ISO-8859-1 for legacy files that are not valid UTF-8.
 */
@Component
@Slf4j
public class PlainTextDocumentExtractor implements DocumentExtractor {

    @Override
    public DocumentFormat format() {
        return DocumentFormat.TXT;
    }

    @Override
    public ExtractedContent extract(Path file) throws IOException {
        String text = decode(Files.readAllBytes(file));
        return ExtractedContent.builder()
                .format(DocumentFormat.TXT)
                .pages(List.of(PageContent.builder().pageNumber(1).rawText(text).build()))
                .build();
    }

    String decode(byte[] bytes) {
        int offset = hasUtf8Bom(bytes) ? 3 : 0;
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes, offset, bytes.length - offset))
                    .toString();
        } catch (CharacterCodingException e) {
            log.debug("Not valid UTF-8, decoding as ISO-8859-1");
            return new String(bytes, StandardCharsets.ISO_8859_1);
        }
    }

    private boolean hasUtf8Bom(byte[] bytes) {
        return bytes.length >= 3
                && (bytes[0] & 0xFF) == 0xEF
                && (bytes[1] & 0xFF) == 0xBB
                && (bytes[2] & 0xFF) == 0xBF;
    }
}
