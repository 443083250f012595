package com.cratedownloads.downloads;

import com.cratedownloads.downloads.model.ResolvedVersion;
import com.cratedownloads.shared.model.Version;
import com.cratedownloads.shared.repository.VersionRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Resolves a crate name and version number to the version's internal ID.
 */
@Service
public class VersionResolver {

    // Semantic Versioning 2.0.0: MAJOR.MINOR.PATCH[-PRERELEASE][+BUILD]
    private static final Pattern SEMVER = Pattern.compile(
            "^(0|[1-9]\\d*)\\.(0|[1-9]\\d*)\\.(0|[1-9]\\d*)"
                    + "(?:-((?:0|[1-9]\\d*|\\d*[a-zA-Z-][0-9a-zA-Z-]*)(?:\\.(?:0|[1-9]\\d*|\\d*[a-zA-Z-][0-9a-zA-Z-]*))*))?"
                    + "(?:\\+([0-9a-zA-Z-]+(?:\\.[0-9a-zA-Z-]+)*))?$");

    private final VersionRepository versionRepository;

    public VersionResolver(VersionRepository versionRepository) {
        this.versionRepository = versionRepository;
    }

    /**
     * @throws VersionNotFoundException if the crate or the version does not exist
     */
    @Transactional(readOnly = true)
    public ResolvedVersion resolve(String crateName, String versionNum) {
        if (crateName == null || crateName.isBlank() || versionNum == null || versionNum.isBlank()) {
            throw new IllegalArgumentException("crate name and version are required");
        }
        Version version = versionRepository.findByCanonicalCrateNameAndNum(canonicalName(crateName), versionNum)
                .orElseThrow(() -> new VersionNotFoundException(crateName, versionNum));
        return new ResolvedVersion(version.getId(), version.getCrate().getName(), version.getNum());
    }

    /**
     * @throws IllegalArgumentException if the version number is not a valid semantic version
     */
    public static String requireSemver(String versionNum) {
        if (versionNum == null || !SEMVER.matcher(versionNum).matches()) {
            throw new IllegalArgumentException("invalid semver: " + versionNum);
        }
        return versionNum;
    }

    /**
     * Crate names compare case-insensitively, with '-' and '_' treated as the same character.
     */
    static String canonicalName(String crateName) {
        return crateName.replace('-', '_').toLowerCase(Locale.ROOT);
    }
}
