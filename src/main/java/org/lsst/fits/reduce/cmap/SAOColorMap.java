package org.lsst.fits.reduce.cmap;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads an SAO colormap file (as read/written by ds9) from the classpath.
 *
 * @author tonyj
 */
public class SAOColorMap extends RGBColorMap {

    private static final Pattern COORD_PATTERN = Pattern.compile("\\(([0-9.]+),([0-9.]+)\\)");
    private final int[] rgb;

    private enum Color {
        RED, GREEN, BLUE
    };

    public SAOColorMap(int size, String colorMap) {
        super(size);
        try (InputStream input = SAOColorMap.class.getResourceAsStream(colorMap)) {
            if (input == null) {
                throw new IllegalArgumentException("Missing sao file: " + colorMap);
            }
            rgb = convertToCMap(size, parse(new BufferedReader(new InputStreamReader(input, StandardCharsets.US_ASCII)), colorMap));
        } catch (IOException x) {
            throw new IllegalArgumentException("Invalid colormap " + colorMap, x);
        }
    }

    private static Map<Color, Interpolation> parse(BufferedReader reader, String colorMap) throws IOException {
        String scheme = nextLine(reader);
        if (!"PSEUDOCOLOR".equals(scheme)) {
            throw new IOException("Unsupported color scheme " + scheme + " in " + colorMap);
        }
        Map<Color, Interpolation> cmap = new EnumMap<>(Color.class);
        Interpolation current = null;
        for (String line = nextLine(reader); line != null; line = nextLine(reader)) {
            if (line.endsWith(":")) {
                current = new Interpolation();
                cmap.put(Color.valueOf(line.replace(":", "")), current);
            } else if (current == null) {
                throw new IOException("Missing color line in " + colorMap);
            } else {
                current.readPoints(line);
            }
        }
        if (cmap.size() != Color.values().length) {
            throw new IOException("Expected RED, GREEN and BLUE sections in " + colorMap);
        }
        return cmap;
    }

    // Comments start with #, blank lines are ignored
    private static String nextLine(BufferedReader reader) throws IOException {
        for (;;) {
            String line = reader.readLine();
            if (line == null) {
                return null;
            }
            String commentRemoved = line.split("#", 2)[0].trim();
            if (!commentRemoved.isEmpty()) {
                return commentRemoved;
            }
        }
    }

    @Override
    public int getRGB(int value) {
        return rgb[value];
    }

    private static int[] convertToCMap(int size, Map<Color, Interpolation> cmap) {
        int[] rgb = new int[size];
        for (int i = 0; i < size; i++) {
            float f = i / (size - 1.0f);
            rgb[i] = Math.round((size - 1) * cmap.get(Color.RED).get(f)) << 16
                    | Math.round((size - 1) * cmap.get(Color.GREEN).get(f)) << 8
                    | Math.round((size - 1) * cmap.get(Color.BLUE).get(f));
        }
        return rgb;
    }

    private static class Interpolation {

        private final List<Float> x = new ArrayList<>();
        private final List<Float> y = new ArrayList<>();

        float get(float value) {
            int binarySearch = Collections.binarySearch(x, value);
            if (binarySearch >= 0) {
                return y.get(binarySearch);
            }
            int upper = -binarySearch - 1;
            if (upper == 0) {
                return y.get(0);
            } else if (upper == x.size()) {
                return y.get(x.size() - 1);
            }
            float x1 = x.get(upper - 1);
            float x2 = x.get(upper);
            float y1 = y.get(upper - 1);
            float y2 = y.get(upper);
            return y1 + (y2 - y1) * (value - x1) / (x2 - x1);
        }

        void readPoints(String line) {
            Matcher matcher = COORD_PATTERN.matcher(line);
            while (matcher.find()) {
                x.add(Float.parseFloat(matcher.group(1)));
                y.add(Float.parseFloat(matcher.group(2)));
            }
        }
    }
}
