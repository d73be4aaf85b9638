package com.example.timesheet.support;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Renders small timesheet PDFs with PDFBox for tests.
 * Weekday columns start at x = 150, 250, 350, 450 and 550; area labels are printed at x = 40.
 */
public final class TimesheetPdfFixture {

    public static final float[] COLUMN_X = {150f, 250f, 350f, 450f, 550f};
    private static final float FONT_SIZE = 8f;

    private TimesheetPdfFixture() {
    }

    /**
     * @return a one-page rota where Rohan works Wednesday 9:30-18:00 (ATM, Kitchen) and Thursday 13:00-21:00 (Bar)
     * @throws IOException when PDFBox cannot create or save the document
     */
    public static byte[] sampleTimesheet() throws IOException {
        return render((stream, font) -> {
            text(stream, font, 250f, 740f, "Week ending 08/03/2024");
            row(stream, font, 700f, "Monday", "Tuesday", "Wednesday", "Thursday", "Friday");
            row(stream, font, 680f, "04.03.2024", "05.03.2024", "06.03.2024", "07.03.2024", "08.03.2024");
            text(stream, font, 40f, 660f, "Kitchen");
            row(stream, font, 660f, "9:00-17:00", "", "9:30-18:00", "9:00-17:00", "off");
            row(stream, font, 640f, "Alice", "", "Jane Rohan ATM", "Rohan", "");
            row(stream, font, 620f, "13:00-21:00", "13:00-21:00", "", "13:00-21:00", "");
            text(stream, font, 40f, 600f, "Bar");
            row(stream, font, 600f, "", "", "", "Rohan", "");
        });
    }

    /**
     * @param text single line printed on an otherwise empty page
     * @return PDF bytes
     * @throws IOException when PDFBox cannot create or save the document
     */
    public static byte[] singleLine(String text) throws IOException {
        return render((stream, font) -> text(stream, font, 72f, 700f, text));
    }

    /**
     * @return a PDF whose page tree is empty
     * @throws IOException when PDFBox cannot save the document
     */
    public static byte[] withoutPages() throws IOException {
        try (PDDocument document = new PDDocument();
             ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {
            document.save(outputStream);
            return outputStream.toByteArray();
        }
    }

    private static byte[] render(PageWriter writer) throws IOException {
        try (PDDocument document = new PDDocument();
             ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {

            PDPage page = new PDPage(PDRectangle.LETTER);
            document.addPage(page);
            PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);

            try (PDPageContentStream contentStream = new PDPageContentStream(document, page)) {
                writer.write(contentStream, font);
            }

            document.save(outputStream);
            return outputStream.toByteArray();
        }
    }

    private static void row(PDPageContentStream stream, PDType1Font font, float y, String... cells) throws IOException {
        for (int i = 0; i < cells.length && i < COLUMN_X.length; i++) {
            if (!cells[i].isEmpty()) {
                text(stream, font, COLUMN_X[i], y, cells[i]);
            }
        }
    }

    private static void text(PDPageContentStream stream, PDType1Font font, float x, float y, String text) throws IOException {
        stream.beginText();
        stream.setFont(font, FONT_SIZE);
        stream.newLineAtOffset(x, y);
        stream.showText(text);
        stream.endText();
    }

    @FunctionalInterface
    private interface PageWriter {
        void write(PDPageContentStream stream, PDType1Font font) throws IOException;
    }
}
