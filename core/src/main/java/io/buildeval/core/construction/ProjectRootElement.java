package io.buildeval.core.construction;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Root of a parsed project file. Holds the file identity, the project-level
 * attributes ({@code Sdk}, {@code DefaultTargets}, {@code InitialTargets},
 * {@code TreatAsLocalProperty}) and the top-level elements in document order.
 */
public final class ProjectRootElement extends ProjectElementContainer {

    private final Path fullPath;
    private final Instant lastWriteTime;
    private final List<SdkElement> sdkElements = new ArrayList<>();

    ProjectRootElement(Path fullPath, Instant lastWriteTime, Map<String, String> attributes, ElementLocation location) {
        super("Project", attributes, location);
        this.fullPath = fullPath;
        this.lastWriteTime = lastWriteTime;
    }

    /** Absolute, normalized path of the file. */
    public Path fullPath() {
        return fullPath;
    }

    /** Directory containing the file. */
    public Path directory() {
        Path dir = fullPath.getParent();
        return dir != null ? dir : fullPath.getRoot();
    }

    /** File name including extension. */
    public String fileName() {
        return fullPath.getFileName().toString();
    }

    /**
     * Last-write time observed when the file was parsed, or
     * {@link Instant#EPOCH} for in-memory projects.
     */
    public Instant lastWriteTime() {
        return lastWriteTime;
    }

    public String sdk() {
        return attribute("Sdk");
    }

    public String defaultTargets() {
        return attribute("DefaultTargets");
    }

    public String initialTargets() {
        return attribute("InitialTargets");
    }

    public String treatAsLocalProperty() {
        return attribute("TreatAsLocalProperty");
    }

    public String toolsVersion() {
        return attribute("ToolsVersion");
    }

    void addSdkElement(SdkElement element) {
        sdkElements.add(element);
        addChild(element);
    }

    /** {@code <Sdk>} child elements in document order. */
    public List<SdkElement> sdkElements() {
        return List.copyOf(sdkElements);
    }

    public List<ImportElement> imports() {
        return childrenOfType(ImportElement.class);
    }

    public List<TargetElement> targets() {
        return childrenOfType(TargetElement.class);
    }

    @Override
    public String toString() {
        return fullPath.toString();
    }
}
