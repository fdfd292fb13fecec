package waveflow.worker.cleanup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Deletes files abandoned in the work area by crashed invocations.
 * <p>
 * Files whose name looks like worker output (hash, waveform, stem, mix or audio
 * related, or an audio extension) go after {@code maxAge}; generic {@code tmp*}
 * files only after {@code aggressiveAge}. Only the top level of the directory is scanned.
 */
public class TempFileSweeper {

    private static final Logger log = LoggerFactory.getLogger(TempFileSweeper.class);

    private static final List<String> NAME_MARKERS = List.of("hash", "waveform", "stem", "mixed", "audio");
    private static final List<String> AUDIO_EXTENSIONS = List.of(".wav", ".mp3", ".flac", ".ogg", ".m4a");

    private final Path dir;
    private final Duration maxAge;
    private final Duration aggressiveAge;
    private final Clock clock;

    public TempFileSweeper(Path dir, Duration maxAge, Duration aggressiveAge) {
        this(dir, maxAge, aggressiveAge, Clock.systemUTC());
    }

    public TempFileSweeper(Path dir, Duration maxAge, Duration aggressiveAge, Clock clock) {
        this.dir = dir;
        this.maxAge = maxAge;
        this.aggressiveAge = aggressiveAge;
        this.clock = clock;
    }

    public Path dir() {
        return dir;
    }

    public SweepResult sweep() throws IOException {
        if (!Files.isDirectory(dir)) {
            log.debug("Work area {} does not exist, nothing to sweep", dir);
            return SweepResult.EMPTY;
        }

        Instant now = clock.instant();
        Instant knownCutoff = now.minus(maxAge);
        Instant genericCutoff = now.minus(aggressiveAge);

        int scanned = 0;
        int deleted = 0;
        int failures = 0;
        long bytes = 0;

        List<Path> files;
        try (Stream<Path> stream = Files.list(dir)) {
            files = stream.toList();
        }

        for (Path file : files) {
            BasicFileAttributes attrs;
            try {
                attrs = Files.readAttributes(file, BasicFileAttributes.class);
            } catch (IOException e) {
                // vanished between listing and stat
                log.debug("Skipping {}: {}", file, e.toString());
                continue;
            }
            if (!attrs.isRegularFile()) {
                continue;
            }
            scanned++;

            String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
            Instant modified = attrs.lastModifiedTime().toInstant();
            boolean expired = (isKnownPattern(name) && modified.isBefore(knownCutoff))
                    || (name.startsWith("tmp") && modified.isBefore(genericCutoff));
            if (!expired) {
                continue;
            }

            try {
                if (Files.deleteIfExists(file)) {
                    deleted++;
                    bytes += attrs.size();
                    log.debug("Swept {} ({} bytes)", file.getFileName(), attrs.size());
                }
            } catch (IOException e) {
                failures++;
                log.warn("Could not sweep {}: {}", file, e.toString());
            }
        }

        if (deleted > 0 || failures > 0) {
            log.info("Swept {}: {} of {} files deleted, {} bytes reclaimed, {} failures",
                    dir, deleted, scanned, bytes, failures);
        }
        return new SweepResult(scanned, deleted, bytes, failures);
    }

    static boolean isKnownPattern(String lowerCaseName) {
        for (String marker : NAME_MARKERS) {
            if (lowerCaseName.contains(marker)) {
                return true;
            }
        }
        for (String ext : AUDIO_EXTENSIONS) {
            if (lowerCaseName.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }
}
