package opshealth.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class OpsHealthPaths {

    @Value("${opshealth.config.path:}")
    public String configPath;

    @Value("${opshealth.base-dir:.}")
    public String baseDir;
}
