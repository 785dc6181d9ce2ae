package com.cra;

import com.cra.atlas.AtlasManifest;
import com.cra.atlas.AtlasManifest.ActionDefinition;
import com.cra.atlas.AtlasManifest.CapabilityDefinition;
import com.cra.atlas.AtlasManifest.ContextPackDefinition;
import com.cra.atlas.AtlasManifest.PolicyDefinition;
import com.cra.atlas.AtlasManifest.PolicyParameters;
import com.cra.atlas.PackCondition;
import com.cra.atlas.PolicyType;
import com.cra.protocol.RiskTier;

import java.util.List;

/**
 * Shared manifests for tests.
 */
public final class TestAtlases {

    public static final String DEV_TOOLS = "dev-tools";

    private TestAtlases() {
    }

    /**
     * file.read (low), file.write (medium), shell.exec (high), db.drop (critical);
     * db.* denied, shell.* needs approval, file.write limited to 2 calls per minute.
     */
    public static AtlasManifest devTools() {
        return devTools(DEV_TOOLS, "1.0.0");
    }

    public static AtlasManifest devTools(String atlasId, String version) {
        return new AtlasManifest(
            AtlasManifest.ATLAS_VERSION,
            atlasId,
            version,
            "Developer tools",
            "File, shell and database actions",
            List.of("development"),
            List.of(
                action("file.read", RiskTier.LOW),
                action("file.write", RiskTier.MEDIUM),
                action("shell.exec", RiskTier.HIGH),
                action("db.drop", RiskTier.CRITICAL)
            ),
            List.of(new CapabilityDefinition("files", "File access", List.of("file.read", "file.write"))),
            List.of(
                new PolicyDefinition("no-db", PolicyType.DENY, List.of("db.*"), "database changes are not allowed",
                    PolicyParameters.none()),
                new PolicyDefinition("shell-approval", PolicyType.REQUIRES_APPROVAL, List.of("shell.*"), null,
                    new PolicyParameters(null, null, "security-team", 600L)),
                new PolicyDefinition("write-limit", PolicyType.RATE_LIMIT, List.of("file.write"), null,
                    new PolicyParameters(2, 60L, null, null))
            ),
            List.of(
                new ContextPackDefinition("trace-guide", "Tracing guide",
                    "Every event is hash chained.", "text/markdown", 5,
                    List.of("hash", "trace", "event", "hashing"), null),
                new ContextPackDefinition("file-guide", "File guide",
                    "Prefer reading before writing.", "text/markdown", 3,
                    List.of("file", "read", "write"), null),
                new ContextPackDefinition("shell-guide", "Shell guide",
                    "Shell commands are audited.", "text/markdown", 8,
                    List.of("shell", "command"),
                    new PackCondition(List.of(RiskTier.HIGH, RiskTier.CRITICAL), List.of(), List.of(), List.of()))
            )
        );
    }

    public static ActionDefinition action(String id, RiskTier risk) {
        return new ActionDefinition(id, id, "Performs " + id, null, risk);
    }
}
