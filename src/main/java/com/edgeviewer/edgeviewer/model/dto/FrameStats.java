package com.edgeviewer.edgeviewer.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.util.Locale;

//Live frame statistics shown next to the viewer
@Getter
@AllArgsConstructor
@Builder
public class FrameStats {

    public static final String MODE_RAW = "Raw";
    public static final String MODE_EDGES = "Edges";

    private final double fps;
    private final int width;
    private final int height;
    private final String mode;

    /**
     * e.g. {@code "15.2 fps, 640x480, Edges"}
     */
    public String getText() {
        return String.format(Locale.US, "%.1f fps, %dx%d, %s", fps, width, height, mode);
    }
}
