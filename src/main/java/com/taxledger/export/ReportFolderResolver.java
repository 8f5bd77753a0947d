package com.taxledger.export;

import com.taxledger.config.BatchConfig;
import com.taxledger.exception.InvalidReportPathException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import org.springframework.stereotype.Component;

/**
 * Maps a report folder named in a request to a path under {@code taxledger.batch.output-dir}.
 * Absolute names and names that climb out with {@code ..} are rejected.
 */
@Component
public class ReportFolderResolver {

    private final BatchConfig batchConfig;

    public ReportFolderResolver(BatchConfig batchConfig) {
        this.batchConfig = batchConfig;
    }

    /**
     * @param requested folder relative to the report root; blank means the root itself
     * @throws InvalidReportPathException if the folder resolves outside the report root
     */
    public Path resolve(String requested) {
        Path root = root();
        if (requested == null || requested.isBlank()) {
            return root;
        }
        Path target;
        try {
            target = root.resolve(requested.trim()).normalize();
        } catch (InvalidPathException e) {
            throw new InvalidReportPathException(requested);
        }
        if (!target.startsWith(root)) {
            throw new InvalidReportPathException(requested);
        }
        return target;
    }

    public Path root() {
        return Path.of(batchConfig.getOutputDir()).toAbsolutePath().normalize();
    }
}
