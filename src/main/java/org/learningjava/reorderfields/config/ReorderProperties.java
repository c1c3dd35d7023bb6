package org.learningjava.reorderfields.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

@Component
@ConfigurationProperties(prefix = "reorder")
public class ReorderProperties {
    private List<String> sourceExtensions = List.of("c", "cc", "cpp", "cxx", "h", "hh", "hpp", "hxx", "inl");
    private List<String> plainCExtensions = List.of("c");

    public List<String> getSourceExtensions() { return sourceExtensions; }
    public void setSourceExtensions(List<String> v) { this.sourceExtensions = v; }
    public List<String> getPlainCExtensions() { return plainCExtensions; }
    public void setPlainCExtensions(List<String> v) { this.plainCExtensions = v; }

    public boolean isSource(String path) {
        return sourceExtensions.contains(extensionOf(path));
    }

    /** Files parsed as C: every record is an aggregate without constructors. */
    public boolean isC(String path) {
        return plainCExtensions.contains(extensionOf(path));
    }

    private static String extensionOf(String path) {
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        int dot = path.lastIndexOf('.');
        return dot > slash ? path.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }
}
