package org.resultvault.engine;

import java.nio.charset.StandardCharsets;
import java.util.List;
import org.resultvault.blob.BlobId;
import org.resultvault.blob.SourceFile;
import org.resultvault.identity.ContentHashes;
import org.resultvault.identity.Fingerprint;
import org.resultvault.identity.IdentityConfidence;
import org.resultvault.identity.Severity;

final class ReportFixtures {
    private ReportFixtures() {}

    static String fingerprint(final String name) {
        return ContentHashes.md5Hex(name);
    }

    static StagedReport staged(final String name, final String checkerId) {
        return staged(name, checkerId, 10, null);
    }

    static StagedReport staged(
            final String name, final String checkerId, final int line, final ReviewDecision sourceReview) {
        SourceFile file = new SourceFile("src/" + name + ".cpp", BlobId.of(name.getBytes(StandardCharsets.UTF_8)));
        return new StagedReport(
                new Fingerprint(fingerprint(name), IdentityConfidence.SCOPED),
                checkerId,
                Severity.HIGH,
                "finding " + name,
                file,
                line,
                4,
                List.of(),
                List.of(new Occurrence(file.path(), file.path(), line, 4)),
                sourceReview);
    }
}
