package com.production.scholar_service.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageContent {
    private int pageNumber;
    private String rawText;
    private String cleanedText;
    private boolean ocr;

    public int contentLength() {
        if (rawText == null) {
            return 0;
        }
        int count = 0;
        for (int i = 0; i < rawText.length(); i++) {
            if (!Character.isWhitespace(rawText.charAt(i))) {
                count++;
            }
        }
        return count;
    }
}
