package com.example.timesheet.infrastructure.pdf;

import com.example.timesheet.domain.model.PageContent;
import com.example.timesheet.domain.model.PositionedToken;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Infrastructure adapter that turns the first page of a PDF into the parser's {@link PageContent}.
 * Words are split on whitespace glyphs so that neighbouring cells printed on one text line never
 * merge into a single token.
 */
@Service
public class PdfBoxTokenSource {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxTokenSource.class);

    /**
     * Strips the text of page 1 while collecting a bounding box for every word.
     *
     * @param document loaded PDF document with at least one page
     * @return page text and positioned words
     * @throws IOException when PDFBox cannot read the page content
     */
    public PageContent readFirstPage(PDDocument document) throws IOException {
        WordCollectingStripper stripper = new WordCollectingStripper();
        stripper.setSortByPosition(true);
        stripper.setSuppressDuplicateOverlappingText(true);
        stripper.setLineSeparator("\n");
        stripper.setStartPage(1);
        stripper.setEndPage(1);
        String text = stripper.getText(document);
        log.debug("Read {} word(s) from page 1", stripper.tokens().size());
        return new PageContent(text, stripper.tokens());
    }

    /**
     * Stripper that records the glyph positions of each whitespace-delimited word it writes.
     */
    private static final class WordCollectingStripper extends PDFTextStripper {
        private final List<PositionedToken> tokens = new ArrayList<>();

        WordCollectingStripper() throws IOException {
            super();
        }

        List<PositionedToken> tokens() {
            return tokens;
        }

        @Override
        protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
            List<TextPosition> word = new ArrayList<>();
            for (TextPosition position : textPositions) {
                String unicode = position.getUnicode();
                if (unicode == null || unicode.isBlank()) {
                    flush(word);
                } else {
                    word.add(position);
                }
            }
            flush(word);
            super.writeString(text, textPositions);
        }

        private void flush(List<TextPosition> word) {
            if (word.isEmpty()) {
                return;
            }
            StringBuilder text = new StringBuilder();
            double x0 = Double.MAX_VALUE;
            double x1 = -Double.MAX_VALUE;
            double top = Double.MAX_VALUE;
            double bottom = -Double.MAX_VALUE;
            for (TextPosition position : word) {
                text.append(position.getUnicode());
                x0 = Math.min(x0, position.getXDirAdj());
                x1 = Math.max(x1, position.getXDirAdj() + position.getWidthDirAdj());
                top = Math.min(top, position.getYDirAdj() - position.getHeightDir());
                bottom = Math.max(bottom, position.getYDirAdj());
            }
            tokens.add(new PositionedToken(text.toString(), x0, x1, top, bottom));
            word.clear();
        }
    }
}
