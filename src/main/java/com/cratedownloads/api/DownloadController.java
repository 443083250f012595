package com.cratedownloads.api;

import com.cratedownloads.downloads.DownloadHistoryReader;
import com.cratedownloads.downloads.DownloadService;
import com.cratedownloads.downloads.VersionResolver;
import com.cratedownloads.downloads.model.DailyDownloadCount;
import com.cratedownloads.downloads.model.DownloadResult;
import com.cratedownloads.downloads.model.ResolvedVersion;
import com.cratedownloads.shared.dto.DownloadUrlResponse;
import com.cratedownloads.shared.dto.VersionDownloadResponse;
import com.cratedownloads.shared.dto.VersionDownloadsResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Controller for crate version download endpoints.
 */
@RestController
@RequestMapping("/api/v1/crates")
@Tag(name = "Downloads", description = "Crate download redirects and daily download history")
public class DownloadController {

    private static final Logger logger = LoggerFactory.getLogger(DownloadController.class);

    private final DownloadService downloadService;
    private final VersionResolver versionResolver;
    private final DownloadHistoryReader downloadHistoryReader;

    @Value("${app.downloads.fill-gaps:false}")
    private boolean defaultFillGaps;

    public DownloadController(
            DownloadService downloadService,
            VersionResolver versionResolver,
            DownloadHistoryReader downloadHistoryReader) {
        this.downloadService = downloadService;
        this.versionResolver = versionResolver;
        this.downloadHistoryReader = downloadHistoryReader;
    }

    @GetMapping("/{crateId}/{version}/download")
    @Operation(summary = "Download a crate version",
               description = "Counts the download and redirects to the stored .crate file, "
                       + "or returns its URL when JSON is requested")
    public ResponseEntity<?> download(
            @Parameter(description = "Crate name") @PathVariable("crateId") String crateId,
            @Parameter(description = "Version number") @PathVariable("version") String version,
            @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {

        DownloadResult result = downloadService.download(crateId, version);

        if (wantsJson(accept)) {
            return ResponseEntity.ok(new DownloadUrlResponse(result.getUrl()));
        }
        return ResponseEntity.status(HttpStatus.FOUND)
                .location(URI.create(result.getUrl()))
                .build();
    }

    @GetMapping("/{crateId}/{version}/downloads")
    @Operation(summary = "Get daily download history",
               description = "Returns the daily download counts of a version for the trailing window "
                       + "ending at before_date (default: today)")
    public ResponseEntity<VersionDownloadsResponse> downloads(
            @Parameter(description = "Crate name") @PathVariable("crateId") String crateId,
            @Parameter(description = "Version number") @PathVariable("version") String version,
            @Parameter(description = "Last day of the window, YYYY-MM-DD")
            @RequestParam(value = "before_date", required = false) String beforeDate,
            @Parameter(description = "Include zero-count days so every day of the window is present")
            @RequestParam(value = "fill_gaps", required = false) Boolean fillGaps) {

        ResolvedVersion resolved = versionResolver.resolve(crateId, VersionResolver.requireSemver(version));
        LocalDate endDate = parseDate(beforeDate);
        boolean fill = fillGaps != null ? fillGaps : defaultFillGaps;

        List<DailyDownloadCount> history = downloadHistoryReader.fetchHistory(resolved.getVersionId(), endDate, fill);

        List<VersionDownloadResponse> body = history.stream()
                .map(day -> new VersionDownloadResponse(resolved.getVersionId(), day.getDate(), day.getDownloads()))
                .toList();
        return ResponseEntity.ok(new VersionDownloadsResponse(body));
    }

    private static boolean wantsJson(String accept) {
        if (accept == null || accept.isBlank()) {
            return false;
        }
        try {
            return MediaType.parseMediaTypes(accept).stream()
                    .anyMatch(type -> !type.isWildcardType() && MediaType.APPLICATION_JSON.isCompatibleWith(type));
        } catch (IllegalArgumentException e) {
            logger.debug("Ignoring unparseable Accept header: {}", accept);
            return false;
        }
    }

    /**
     * Returns null (today) when the date is missing or not in YYYY-MM-DD form.
     */
    static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            logger.debug("Ignoring invalid before_date: {}", value);
            return null;
        }
    }
}
