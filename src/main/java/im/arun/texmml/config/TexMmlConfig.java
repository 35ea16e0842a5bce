package im.arun.texmml.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TexMmlConfig {
    @JsonProperty("localization")
    private String localization = "en";

    @JsonProperty("encoding")
    private String encoding = "UTF-8";

    @JsonProperty("timeout_seconds")
    private int timeoutSeconds = 120;

    @JsonProperty("fail_on_missing_import")
    private boolean failOnMissingImport = true;

    @JsonProperty("fail_on_missing_bibliography")
    private boolean failOnMissingBibliography = false;

    @JsonProperty("max_macro_expansion_depth")
    private int maxMacroExpansionDepth = 32;

    @JsonProperty("verify_tree")
    private boolean verifyTree = true;

    @JsonProperty("json_log_enabled")
    private boolean jsonLogEnabled = false;

    @JsonProperty("log_directory")
    private String logDirectory = "./logs";
}
