package com.myorg.normcontrol.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "storage")
public class StorageProperties {

    /** Directory that receives report JSON files and the history index. */
    private String basePath = "./data/reports";

    private String historyFile = "analysis_history.jsonl";
}
