package com.healthecon.core.processor;

import com.healthecon.common.constants.FileTypes;
import com.healthecon.llm.model.BillContent;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Prepares a stored bill for the reasoning service. PDFs are sent as an image of their first page.
 */
@Component
@Slf4j
public class BillContentReader {

    static final float RENDER_DPI = 150f;

    public BillContent read(String billId, String fileType, Path file) throws IOException {
        String category = FileTypes.getCategory(fileType);
        return switch (category) {
            case "PDF" -> BillContent.builder()
                .billId(billId)
                .mediaType("image/png")
                .data(renderFirstPage(file))
                .build();
            case "IMAGE" -> BillContent.builder()
                .billId(billId)
                .mediaType("png".equalsIgnoreCase(fileType) ? "image/png" : "image/jpeg")
                .data(Files.readAllBytes(file))
                .build();
            case "TEXT" -> BillContent.builder()
                .billId(billId)
                .mediaType("text/plain")
                .data(Files.readAllBytes(file))
                .build();
            default -> throw new IOException("Unsupported bill file type: " + fileType);
        };
    }

    private byte[] renderFirstPage(Path file) throws IOException {
        try (PDDocument document = Loader.loadPDF(file.toFile())) {
            if (document.getNumberOfPages() == 0) {
                throw new IOException("PDF has no pages: " + file.getFileName());
            }
            BufferedImage page = new PDFRenderer(document).renderImageWithDPI(0, RENDER_DPI);
            ByteArrayOutputStream png = new ByteArrayOutputStream();
            ImageIO.write(page, "png", png);
            log.debug("[BILLS] Rendered first PDF page | file={} | pages={} | pngBytes={}",
                file.getFileName(), document.getNumberOfPages(), png.size());
            return png.toByteArray();
        }
    }
}
