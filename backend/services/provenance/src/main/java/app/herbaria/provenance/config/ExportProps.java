package app.herbaria.provenance.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.provenance.export")
public record ExportProps(
        Integer pageSize
) {
    public ExportProps {
        pageSize = (pageSize == null || pageSize < 1) ? 200 : Math.min(pageSize, 1000);
    }
}
