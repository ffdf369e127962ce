package com.gembridge.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gembridge.config.GembridgeProperties;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Identifies this gateway to Code Assist the way the Gemini CLI identifies itself.
 */
@Component
public class ClientMetadata {

    static final String PLATFORM_UNSPECIFIED = "PLATFORM_UNSPECIFIED";

    private final ObjectMapper objectMapper;
    private final String userAgent;
    private final String platform;

    public ClientMetadata(ObjectMapper objectMapper, GembridgeProperties properties) {
        this(objectMapper, properties.getUpstream().getCliVersion(),
                System.getProperty("os.name", ""), System.getProperty("os.arch", ""));
    }

    ClientMetadata(ObjectMapper objectMapper, String cliVersion, String osName, String osArch) {
        this.objectMapper = objectMapper;
        this.userAgent = "GeminiCLI/" + cliVersion + " (" + osName + "; " + osArch + ")";
        this.platform = platformOf(osName, osArch);
    }

    public String userAgent() {
        return userAgent;
    }

    public String platform() {
        return platform;
    }

    /**
     * Metadata block sent with loadCodeAssist and onboardUser.
     *
     * @param projectId cloud project, omitted when null
     */
    public ObjectNode metadata(String projectId) {
        ObjectNode metadata = objectMapper.createObjectNode();
        metadata.put("ideType", "IDE_UNSPECIFIED");
        metadata.put("platform", platform);
        metadata.put("pluginType", "GEMINI");
        if (projectId != null) {
            metadata.put("duetProject", projectId);
        }
        return metadata;
    }

    static String platformOf(String osName, String osArch) {
        String os = osName.toLowerCase(Locale.ROOT);
        String arch = osArch.toLowerCase(Locale.ROOT);
        boolean arm = arch.equals("aarch64") || arch.equals("arm64");
        boolean x64 = arch.equals("amd64") || arch.equals("x86_64");

        if (os.contains("mac") || os.contains("darwin")) {
            return arm ? "DARWIN_ARM64" : x64 ? "DARWIN_AMD64" : PLATFORM_UNSPECIFIED;
        }
        if (os.contains("linux")) {
            return arm ? "LINUX_ARM64" : x64 ? "LINUX_AMD64" : PLATFORM_UNSPECIFIED;
        }
        if (os.contains("windows") && x64) {
            return "WINDOWS_AMD64";
        }
        return PLATFORM_UNSPECIFIED;
    }
}
