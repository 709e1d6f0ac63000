package work.canopy.envelope;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

public final class Hasher {
    static final String ALGORITHM = "md5";
    static final int PREFIX_BYTES = 1000;
    private static final int BUFFER_SIZE = 8192;

    private final HashProfile profile;

    public Hasher(HashProfile profile) {
        this.profile = Objects.requireNonNull(profile, "profile");
    }

    public HashProfile profile() {
        return profile;
    }

    public HashInfo hash(Path path) {
        if (profile == HashProfile.TEST) {
            return HashInfo.skipped("test profile");
        }
        if (!Files.isRegularFile(path)) {
            return HashInfo.skipped("not a regular file: " + path);
        }
        try {
            return profile == HashProfile.DEV ? metadataHash(path) : fullHash(path);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to hash " + path, ex);
        }
    }

    private HashInfo fullHash(Path path) throws IOException {
        var digest = newDigest();
        try (var in = Files.newInputStream(path)) {
            var buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return HashInfo.computed(HexFormat.of().formatHex(digest.digest()), HashMethod.FULL_FILE, ALGORITHM);
    }

    private HashInfo metadataHash(Path path) throws IOException {
        var digest = newDigest();
        digest.update(Long.toString(Files.size(path)).getBytes(StandardCharsets.UTF_8));
        digest.update(Long.toString(Files.getLastModifiedTime(path).toMillis()).getBytes(StandardCharsets.UTF_8));
        try (var in = Files.newInputStream(path)) {
            digest.update(in.readNBytes(PREFIX_BYTES));
        }
        return HashInfo.computed(HexFormat.of().formatHex(digest.digest()), HashMethod.METADATA, ALGORITHM);
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("MD5 digest unavailable", ex);
        }
    }
}
