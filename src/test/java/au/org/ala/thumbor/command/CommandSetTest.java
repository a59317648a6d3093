package au.org.ala.thumbor.command;

import au.org.ala.thumbor.TestBase;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

@RunWith(JUnit4.class)
public class CommandSetTest extends TestBase {

    @Test
    public void testEmpty() {
        assertEquals(Collections.emptyList(), new CommandSet().toArray());
    }

    @Test
    public void testSegmentOrderIgnoresCallOrder() {
        CommandSet commands = new CommandSet();
        commands.quality(80);
        commands.smartCrop(true);
        commands.valign("top");
        commands.halign("left");
        commands.fitIn(640, 480);
        commands.crop(10, 20, 100, 200);
        commands.trim();
        commands.metadataOnly(true);

        List<String> expected = Arrays.asList(
                "meta", "trim", "10x20:100x200", "fit-in/640x480", "left", "top", "smart", "filters:quality(80)");
        assertEquals(expected, commands.toArray());
    }

    @Test
    public void testTrimVariants() {
        CommandSet commands = new CommandSet();
        commands.trim();
        assertEquals(List.of("trim"), commands.toArray());

        commands.trim("bottom-right");
        assertEquals(List.of("trim:bottom-right"), commands.toArray());

        commands.trim("top-left", 50);
        assertEquals(List.of("trim:top-left:50"), commands.toArray());

        commands.trim((String) null, 10);
        assertEquals(List.of("trim:10"), commands.toArray());

        commands.trim(TrimColourSource.BOTTOM_RIGHT, null);
        assertEquals(List.of("trim:bottom-right"), commands.toArray());
    }

    @Test
    public void testCropIsNotValidated() {
        CommandSet commands = new CommandSet();
        commands.crop(100, 200, 10, 20);
        assertEquals(List.of("100x200:10x20"), commands.toArray());
    }

    @Test
    public void testLastResizeWins() {
        CommandSet commands = new CommandSet();
        commands.fitIn(640, 480);
        commands.resize(320, 240);
        assertEquals(List.of("320x240"), commands.toArray());

        commands.fullFitIn(800, 600);
        assertEquals(List.of("full-fit-in/800x600"), commands.toArray());

        commands.adaptiveFitIn(300, 200);
        assertEquals(List.of("adaptive-fit-in/300x200"), commands.toArray());

        commands.resize(Dimension.orig(), Dimension.of(100));
        assertEquals(List.of("origx100"), commands.toArray());

        commands.fitIn(1, 2);
        assertEquals(List.of("fit-in/1x2"), commands.toArray());
        assertEquals(Resize.fitIn(1, 2), commands.getResize());
    }

    @Test
    public void testFlipFitIn() {
        CommandSet commands = new CommandSet();
        commands.fitIn(640, 480);
        commands.flipHorizontal(true);
        assertEquals(List.of("fit-in/-640x480"), commands.toArray());

        commands.flipVertical(true);
        assertEquals(List.of("fit-in/-640x-480"), commands.toArray());

        commands.flipHorizontal(false);
        assertEquals(List.of("fit-in/640x-480"), commands.toArray());
    }

    @Test
    public void testFlipOtherResizeKinds() {
        CommandSet commands = new CommandSet();
        commands.flipHorizontal(true);
        commands.flipVertical(true);

        commands.fullFitIn(800, 600);
        assertEquals(List.of("full-fit-in/-800x-600"), commands.toArray());

        commands.adaptiveFitIn(300, 200);
        assertEquals(List.of("adaptive-fit-in/-300x-200"), commands.toArray());

        commands.resize(320, 240);
        assertEquals(List.of("-320x-240"), commands.toArray());
    }

    @Test
    public void testFlipVerticalWithOrigWidth() {
        CommandSet commands = new CommandSet();
        commands.resize(Dimension.orig(), Dimension.of(480));
        commands.flipVertical(true);
        assertEquals(List.of("origx-480"), commands.toArray());

        commands.flipHorizontal(true);
        assertEquals(List.of("origx-480"), commands.toArray());
    }

    @Test
    public void testFlipWithoutResizeIsIgnored() {
        CommandSet commands = new CommandSet();
        commands.flipHorizontal(true);
        commands.flipVertical(true);
        assertTrue(commands.toArray().isEmpty());
        assertTrue(commands.isFlipHorizontal());
        assertTrue(commands.isFlipVertical());
    }

    @Test
    public void testRenderIsIdempotent() {
        CommandSet commands = new CommandSet();
        commands.fitIn(640, 480);
        commands.flipHorizontal(true);
        commands.flipVertical(true);

        List<String> first = commands.toArray();
        List<String> second = commands.toArray();
        assertEquals(first, second);
        assertEquals(List.of("fit-in/-640x-480"), second);
        assertEquals(Resize.fitIn(640, 480), commands.getResize());
    }

    @Test
    public void testAlignmentIsPassedThrough() {
        CommandSet commands = new CommandSet();
        commands.halign("diagonal");
        commands.valign("sideways");
        assertEquals(List.of("diagonal", "sideways"), commands.toArray());

        commands.halign(HorizontalAlign.CENTER);
        commands.valign(VerticalAlign.MIDDLE);
        assertEquals(List.of("center", "middle"), commands.toArray());
    }

    @Test
    public void testSmartCropKeepsAlignment() {
        CommandSet commands = new CommandSet();
        commands.halign("right");
        commands.smartCrop(true);
        assertEquals(List.of("right", "smart"), commands.toArray());

        commands.smartCrop(false);
        assertEquals(List.of("right"), commands.toArray());
    }

    @Test
    public void testFiltersKeepCallOrderAndDuplicates() {
        CommandSet commands = new CommandSet();
        commands.addFilter("brightness", 50);
        commands.addFilter("contrast", 20);
        commands.addFilter("brightness", 50);
        commands.addFilter("sharpen", 1.5, 0.5, true);

        List<String> result = commands.toArray();
        assertEquals(1, result.size());
        assertEquals("filters:brightness(50):contrast(20):brightness(50):sharpen(1.5,0.5,true)", result.get(0));
        assertEquals(4, commands.getFilters().size());
    }

    @Test
    public void testFilterWithoutArguments() {
        CommandSet commands = new CommandSet();
        commands.addFilter(Filter.of("equalize"));
        assertEquals(List.of("filters:equalize()"), commands.toArray());
    }

    @Test
    public void testQualityOutOfRangePassesThrough() {
        CommandSet commands = new CommandSet();
        commands.quality(250);
        assertEquals(List.of("filters:quality(250)"), commands.toArray());
    }

    @Test
    public void testFilterShortcuts() {
        CommandSet commands = new CommandSet();
        commands.quality(80);
        commands.format("png");
        commands.format(ImageFormat.HEIC);
        commands.webp();
        commands.avif();
        commands.blur(2);
        commands.blur(3, 1);
        commands.brightness(-10);
        commands.contrast(20);
        commands.grayscale();
        commands.rotate(90);
        commands.sharpen(2, 1);
        commands.sharpen(1.5, 0.5, true);
        commands.noise(30);
        commands.watermark("https://example.com/w.png");
        commands.watermark("https://example.com/w.png", -10, 10, 50);
        commands.fill("ff0000");
        commands.roundCorners(20);
        commands.roundCorners(20, 255, 255, 255);
        commands.stripExif();
        commands.stripIcc();
        commands.noUpscale();
        commands.saturation(1.0);
        commands.rgb(10, -10, 0);
        commands.maxBytes(75000);
        commands.equalize();

        String expected = "filters:quality(80):format(png):format(heic):format(webp):format(avif)"
                + ":blur(2):blur(3,1):brightness(-10):contrast(20):grayscale():rotate(90)"
                + ":sharpen(2,1,false):sharpen(1.5,0.5,true):noise(30)"
                + ":watermark(https://example.com/w.png,0,0,0):watermark(https://example.com/w.png,-10,10,50)"
                + ":fill(ff0000):round_corner(20):round_corner(20,255,255,255)"
                + ":strip_exif():strip_icc():no_upscale():saturation(1):rgb(10,-10,0)"
                + ":max_bytes(75000):equalize()";
        assertEquals(List.of(expected), commands.toArray());
    }

    @Test
    public void testConvolution() {
        CommandSet commands = new CommandSet();
        commands.convolution(new int[]{1, 2, 1, 2, 4, 2, 1, 2, 1}, 3);
        commands.convolution(new int[]{-1, -1, -1, -1, 8, -1, -1, -1, -1}, 3, true);
        commands.convolution(new double[]{0.5, 1.0, -0.25}, 3);
        assertEquals(List.of("filters:convolution(1;2;1;2;4;2;1;2;1,3,false)"
                + ":convolution(-1;-1;-1;-1;8;-1;-1;-1;-1,3,true)"
                + ":convolution(0.5;1;-0.25,3,false)"), commands.toArray());
    }

    @Test
    public void testCopyIsIndependent() {
        CommandSet original = new CommandSet();
        original.fitIn(640, 480);
        original.quality(80);

        CommandSet copy = new CommandSet(original);
        copy.grayscale();
        copy.flipHorizontal(true);
        original.resize(10, 10);

        assertEquals(List.of("10x10", "filters:quality(80)"), original.toArray());
        assertEquals(List.of("fit-in/-640x480", "filters:quality(80):grayscale()"), copy.toArray());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testRenderedSegmentsAreImmutable() {
        CommandSet commands = new CommandSet();
        commands.smartCrop(true);
        commands.toArray().add("meta");
    }

    @Test
    public void testTokenEnumsParse() {
        assertEquals(HorizontalAlign.CENTER, HorizontalAlign.parse("Centre"));
        assertEquals(VerticalAlign.BOTTOM, VerticalAlign.parse(" bottom"));
        assertEquals(TrimColourSource.TOP_LEFT, TrimColourSource.parse("TOP-LEFT"));
        assertEquals(ImageFormat.JPEG, ImageFormat.parse("jpg"));
        assertEquals("jpeg", ImageFormat.JPEG.canonical());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownFormatRejected() {
        ImageFormat.parse("bmp");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownAlignmentRejected() {
        HorizontalAlign.parse("middle");
    }
}
