package se.bolan.ratedb.extract.pdf;

import java.io.IOException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.bolan.ratedb.extract.ExtractionException;

/** Extracts the plain text of a PDF, page by page */
public class PdfText {
	private static final Logger logger = LoggerFactory.getLogger(PdfText.class);

	private PdfText() {}

	/**
	 * Extract the text of every page, separated by newlines. A page whose text can not be read is
	 * logged and left out.
	 *
	 * @throws ExtractionException if the bytes are not a readable PDF
	 */
	public static String extract(byte[] pdf) throws ExtractionException {
		try (PDDocument document = Loader.loadPDF(pdf)) {
			var text = new StringBuilder();
			var stripper = new PDFTextStripper();
			int pages = document.getNumberOfPages();
			for (int page = 1; page <= pages; page++) {
				stripper.setStartPage(page);
				stripper.setEndPage(page);
				try {
					text.append(stripper.getText(document)).append('\n');
				} catch (IOException | RuntimeException e) {
					logger.warn("Failed to extract text from PDF page {}: {}", page, e.getMessage());
				}
			}
			return text.toString();
		} catch (IOException e) {
			throw new ExtractionException("Failed to read PDF: " + e.getMessage(), e);
		}
	}
}
