package com.example.timesheet.application.service;

import com.example.timesheet.application.parser.WeeklyScheduleParser;
import com.example.timesheet.config.TimesheetProperties;
import com.example.timesheet.domain.exception.PdfFileRequiredException;
import com.example.timesheet.domain.exception.ScheduleNotFoundException;
import com.example.timesheet.domain.exception.UnsupportedPdfFormatException;
import com.example.timesheet.domain.model.ExtractionFailure;
import com.example.timesheet.domain.model.PageContent;
import com.example.timesheet.domain.model.SourceDocumentInfo;
import com.example.timesheet.domain.model.TimesheetExtractionResult;
import com.example.timesheet.domain.model.WeekRecord;
import com.example.timesheet.infrastructure.exception.PdfProcessingException;
import com.example.timesheet.infrastructure.pdf.PdfBoxDocumentInfoReader;
import com.example.timesheet.infrastructure.pdf.PdfBoxTokenSource;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Locale;

/**
 * Application-layer service that orchestrates timesheet uploads.
 * It validates the upload, lets PDFBox adapters read the first page and hands the page to the
 * {@link WeeklyScheduleParser} together with the configured employee name.
 */
@Service
public class TimesheetService {

    private static final Logger log = LoggerFactory.getLogger(TimesheetService.class);

    private final WeeklyScheduleParser scheduleParser;
    private final PdfBoxTokenSource tokenSource;
    private final PdfBoxDocumentInfoReader documentInfoReader;
    private final TimesheetProperties properties;

    public TimesheetService(WeeklyScheduleParser scheduleParser,
                            PdfBoxTokenSource tokenSource,
                            PdfBoxDocumentInfoReader documentInfoReader,
                            TimesheetProperties properties) {
        this.scheduleParser = scheduleParser;
        this.tokenSource = tokenSource;
        this.documentInfoReader = documentInfoReader;
        this.properties = properties;
    }

    /**
     * Extracts the configured employee's week from an uploaded timesheet.
     *
     * @param file uploaded PDF
     * @return resolved week with upload context
     * @throws PdfFileRequiredException      when the file is null or empty
     * @throws UnsupportedPdfFormatException when the MIME type and name do not look like a PDF
     * @throws ScheduleNotFoundException     when the timesheet holds no schedule for the employee
     * @throws PdfProcessingException        when PDFBox cannot read the bytes
     */
    public TimesheetExtractionResult extractSchedule(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new PdfFileRequiredException();
        }
        if (!looksLikePdf(file)) {
            throw new UnsupportedPdfFormatException(file.getOriginalFilename());
        }

        try {
            return extractSchedule(file.getBytes(), resolveFileName(file));
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to process the uploaded PDF file.", e);
        }
    }

    /**
     * Extracts the configured employee's week from PDF bytes already held in memory.
     *
     * @param bytes    PDF content
     * @param fileName logical name used for display purposes
     * @return resolved week with upload context
     * @throws IOException when PDFBox cannot load the bytes or read page 1
     */
    TimesheetExtractionResult extractSchedule(byte[] bytes, String fileName) throws IOException {
        String targetName = properties.getTargetName();
        try (PDDocument document = Loader.loadPDF(bytes)) {
            if (document.getNumberOfPages() == 0) {
                throw new ScheduleNotFoundException(ExtractionFailure.NO_PAGES);
            }
            SourceDocumentInfo documentInfo = documentInfoReader.read(document);
            PageContent page = tokenSource.readFirstPage(document);
            WeekRecord week = scheduleParser.extract(page, targetName);
            log.info("Extracted week ending {} for {} from {}", week.weekEnding(), targetName, fileName);
            return new TimesheetExtractionResult(fileName, targetName, week, documentInfo);
        } catch (ScheduleNotFoundException ex) {
            log.info("No schedule for {} in {}: {}", targetName, fileName, ex.reason());
            throw ex;
        }
    }

    private boolean looksLikePdf(MultipartFile file) {
        String contentType = file.getContentType();
        if (contentType != null && contentType.equalsIgnoreCase("application/pdf")) {
            return true;
        }
        String fileName = file.getOriginalFilename();
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    private String resolveFileName(MultipartFile file) {
        String fileName = file.getOriginalFilename();
        if (fileName == null || fileName.isBlank()) {
            return "timesheet.pdf";
        }
        return fileName;
    }
}
