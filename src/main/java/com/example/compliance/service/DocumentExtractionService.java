package com.example.compliance.service;

import com.example.compliance.exception.ExtractionException;
import com.example.compliance.exception.ExtractionException.Reason;
import com.example.compliance.model.ProcessedDocument;
import com.example.compliance.model.SourceDocument;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns uploaded documents into clean text and chunks.
 * PDFs are read with PDFBox page by page, Word documents with POI (paragraphs, then table rows);
 * {@code .txt} and {@code .md} files are decoded as UTF-8.
 */
@Service
public class DocumentExtractionService {

    private static final Logger log = LoggerFactory.getLogger(DocumentExtractionService.class);

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final TextChunker chunker;

    public DocumentExtractionService(TextChunker chunker) {
        this.chunker = chunker;
    }

    /**
     * Extracts, cleans and chunks the document.
     *
     * @throws ExtractionException if the format is unsupported or the content cannot be parsed
     */
    public ProcessedDocument process(SourceDocument document) {
        log.info("Processing document '{}' ({} bytes)", document.filename(), document.content().length);

        String cleanText = clean(extract(document));
        List<String> chunks = chunker.chunk(cleanText);

        log.info("Extracted {} characters from '{}', created {} chunks",
                cleanText.length(), document.filename(), chunks.size());
        return new ProcessedDocument(cleanText, chunks);
    }

    /**
     * Extracts raw text, choosing the strategy from the file extension.
     */
    public String extract(SourceDocument document) {
        return switch (document.extension()) {
            case "pdf" -> extractPdf(document);
            case "docx" -> extractDocx(document);
            case "txt", "md" -> extractPlainText(document);
            default -> throw new ExtractionException(Reason.UNSUPPORTED_FORMAT,
                    "Unsupported file format: '%s'".formatted(document.filename()));
        };
    }

    /**
     * Normalizes line endings, strips control characters and collapses whitespace.
     */
    public String clean(String rawText) {
        if (rawText == null) return "";
        String text = rawText.replace("\r\n", "\n").replace('\r', '\n');
        text = CONTROL_CHARS.matcher(text).replaceAll("");
        text = WHITESPACE.matcher(text).replaceAll(" ");
        return text.strip();
    }

    private String extractPdf(SourceDocument document) {
        try (PDDocument pdf = Loader.loadPDF(document.content())) {
            PDFTextStripper stripper = new PDFTextStripper();
            List<String> pages = new ArrayList<>();
            for (int page = 1; page <= pdf.getNumberOfPages(); page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                String text = stripper.getText(pdf);
                if (text != null && !text.isBlank()) {
                    pages.add(text);
                }
            }
            log.debug("PDF '{}': {} pages with text", document.filename(), pages.size());
            return String.join("\n\n", pages);
        } catch (IOException e) {
            throw new ExtractionException(Reason.PARSE_FAILURE,
                    "Failed to extract text from PDF '%s': %s".formatted(document.filename(), e.getMessage()), e);
        }
    }

    private String extractDocx(SourceDocument document) {
        try (XWPFDocument docx = new XWPFDocument(new ByteArrayInputStream(document.content()))) {
            List<String> parts = new ArrayList<>();
            for (XWPFParagraph paragraph : docx.getParagraphs()) {
                String text = paragraph.getText();
                if (text != null && !text.isBlank()) {
                    parts.add(text);
                }
            }
            for (XWPFTable table : docx.getTables()) {
                for (XWPFTableRow row : table.getRows()) {
                    List<String> cells = row.getTableCells().stream()
                            .map(XWPFTableCell::getText)
                            .map(String::strip)
                            .toList();
                    if (cells.stream().anyMatch(cell -> !cell.isEmpty())) {
                        parts.add(String.join(" | ", cells));
                    }
                }
            }
            log.debug("DOCX '{}': {} text blocks", document.filename(), parts.size());
            return String.join("\n\n", parts);
        } catch (IOException | RuntimeException e) {
            throw new ExtractionException(Reason.PARSE_FAILURE,
                    "Failed to extract text from Word document '%s': %s".formatted(document.filename(), e.getMessage()), e);
        }
    }

    private String extractPlainText(SourceDocument document) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(document.content()))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new ExtractionException(Reason.PARSE_FAILURE,
                    "File '%s' is not valid UTF-8 text".formatted(document.filename()), e);
        }
    }
}
