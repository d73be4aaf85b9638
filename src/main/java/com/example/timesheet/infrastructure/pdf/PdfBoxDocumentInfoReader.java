package com.example.timesheet.infrastructure.pdf;

import com.example.timesheet.domain.model.SourceDocumentInfo;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.common.PDMetadata;
import org.apache.xmpbox.XMPMetadata;
import org.apache.xmpbox.schema.XMPBasicSchema;
import org.apache.xmpbox.xml.DomXmpParser;
import org.apache.xmpbox.xml.XmpParsingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Calendar;

/**
 * Summarises where an uploaded timesheet came from, using the info dictionary first and the
 * XMP packet as a fallback for the creation date and as the only source of the creator tool.
 */
@Service
public class PdfBoxDocumentInfoReader {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxDocumentInfoReader.class);
    private static final DateTimeFormatter CALENDAR_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    /**
     * @param document already opened PDF document
     * @return document summary, never {@code null}
     */
    public SourceDocumentInfo read(PDDocument document) {
        PDDocumentInformation info = document.getDocumentInformation();
        XMPBasicSchema xmpBasic = readXmpBasic(document);

        String title = info != null ? info.getTitle() : null;
        String producer = info != null ? info.getProducer() : null;
        String creationDate = info != null ? formatCalendar(info.getCreationDate()) : null;
        if (creationDate == null && xmpBasic != null) {
            creationDate = formatCalendar(xmpBasic.getCreateDate());
        }
        String creatorTool = xmpBasic != null ? xmpBasic.getCreatorTool() : null;

        return new SourceDocumentInfo(document.getNumberOfPages(), title, producer, creationDate, creatorTool);
    }

    private XMPBasicSchema readXmpBasic(PDDocument document) {
        if (document.getDocumentCatalog() == null) {
            return null;
        }
        PDMetadata pdMetadata = document.getDocumentCatalog().getMetadata();
        if (pdMetadata == null) {
            return null;
        }
        try (InputStream metadataStream = pdMetadata.exportXMPMetadata()) {
            if (metadataStream == null) {
                return null;
            }
            DomXmpParser parser = new DomXmpParser();
            parser.setStrictParsing(false);
            XMPMetadata xmp = parser.parse(metadataStream);
            return xmp.getXMPBasicSchema();
        } catch (IOException | XmpParsingException ex) {
            log.warn("Failed to parse XMP metadata", ex);
            return null;
        }
    }

    private String formatCalendar(Calendar calendar) {
        if (calendar == null) {
            return null;
        }
        return CALENDAR_FORMATTER.format(calendar.toInstant().atZone(ZoneId.systemDefault()));
    }
}
