package com.docgram.service.rag;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.imageio.ImageIO;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

/** PDFBox-based access to uploaded PDFs: page count, per-page text and first-page thumbnail. */
@Component
@Slf4j
public class PdfDocumentReader {

  /**
   * Counts pages without failing.
   *
   * @return the page count, or 0 when the bytes cannot be parsed
   */
  public int countPages(byte[] pdfBytes) {
    try (PDDocument document = Loader.loadPDF(pdfBytes)) {
      return document.getNumberOfPages();
    } catch (IOException | RuntimeException e) {
      log.warn("Could not count PDF pages: {}", e.getMessage());
      return 0;
    }
  }

  /**
   * Extracts the text of every page, in page order.
   *
   * @throws IOException if the document cannot be parsed
   */
  public List<String> extractPages(byte[] pdfBytes) throws IOException {
    try (PDDocument document = Loader.loadPDF(pdfBytes)) {
      PDFTextStripper stripper = new PDFTextStripper();
      stripper.setSortByPosition(true);
      int pageCount = document.getNumberOfPages();
      List<String> pages = new ArrayList<>(pageCount);
      for (int page = 1; page <= pageCount; page++) {
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        pages.add(stripper.getText(document));
      }
      return pages;
    }
  }

  /** Renders page 1 as PNG; empty when the document has no pages or cannot be rendered. */
  public Optional<byte[]> renderThumbnail(byte[] pdfBytes, float dpi) {
    try (PDDocument document = Loader.loadPDF(pdfBytes)) {
      if (document.getNumberOfPages() == 0) {
        return Optional.empty();
      }
      BufferedImage image = new PDFRenderer(document).renderImageWithDPI(0, dpi, ImageType.RGB);
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      ImageIO.write(image, "png", out);
      return Optional.of(out.toByteArray());
    } catch (IOException | RuntimeException e) {
      log.warn("Could not render PDF thumbnail: {}", e.getMessage());
      return Optional.empty();
    }
  }
}
