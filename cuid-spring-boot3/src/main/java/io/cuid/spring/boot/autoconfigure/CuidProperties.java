package io.cuid.spring.boot.autoconfigure;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

@Data
@ConfigurationProperties("cuid")
public class CuidProperties {
    private String defaultGenerator = "default";
    private Map<String, CuidGeneratorProperties> generators = new HashMap<>();
}
