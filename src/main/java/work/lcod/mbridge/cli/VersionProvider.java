package work.lcod.mbridge.cli;

import picocli.CommandLine;
import work.lcod.mbridge.api.MBridge;

final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        return new String[] { "mbridge (java) " + MBridge.bridgeVersion() };
    }
}
