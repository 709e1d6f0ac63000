package work.canopy.cli;

import picocli.CommandLine;
import work.canopy.envelope.EnvelopeSchema;

final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        return new String[] {
            "canopy " + (implementationVersion != null ? implementationVersion : "development"),
            "bundled envelope schema: classpath:" + EnvelopeSchema.BUNDLED_RESOURCE
        };
    }
}
