/*
 * Copyright 2022 Jim Carroll
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.kognition.mastcam4j.image;

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encoding of finished rasters to image files through ImageIO.
 */
public class ImageFile {
    private static final Logger LOGGER = LoggerFactory.getLogger(ImageFile.class);

    private ImageFile() {}

    /**
     * <p>
     * Write the raster as an 8-bit RGB PNG. Values are rounded and clamped to [0, 255]. The
     * parent directory is created if needed.
     * </p>
     *
     * <p>
     * The image is encoded to a temporary file next to the destination and then moved into
     * place so a failed write never leaves a partial file at {@code file}.
     * </p>
     */
    public static void writePng(final RgbRaster raster, final Path file) throws IOException {
        final Path target = file.toAbsolutePath();
        final Path dir = target.getParent();
        if(dir != null)
            Files.createDirectories(dir);

        final Path tmp = Files.createTempFile(dir, "." + target.getFileName().toString(), ".tmp");
        boolean moved = false;
        try {
            doWrite(toBufferedImage(raster), tmp, "png");
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch(final AtomicMoveNotSupportedException amnse) {
                LOGGER.debug("Atomic move isn't supported for {}. Falling back to a plain move.", target);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            moved = true;
            LOGGER.trace("Wrote {} to {}", raster, target);
        } finally {
            if(!moved)
                Files.deleteIfExists(tmp);
        }
    }

    /**
     * Convert the raster to a {@link BufferedImage#TYPE_3BYTE_BGR} image, rounding and clamping
     * every value to [0, 255].
     */
    public static BufferedImage toBufferedImage(final RgbRaster raster) {
        final BufferedImage ret = new BufferedImage(raster.cols, raster.rows, BufferedImage.TYPE_3BYTE_BGR);
        final byte[] data = ((DataBufferByte)ret.getRaster().getDataBuffer()).getData();
        final double[] red = raster.plane(0);
        final double[] green = raster.plane(1);
        final double[] blue = raster.plane(2);
        for(int i = 0; i < red.length; i++) {
            final int pos = i * 3;
            data[pos] = toByte(blue[i]);
            data[pos + 1] = toByte(green[i]);
            data[pos + 2] = toByte(red[i]);
        }
        return ret;
    }

    /**
     * Read an image file back into a raster with values in [0, 255].
     */
    public static RgbRaster readRgb(final Path file) throws IOException {
        final BufferedImage bi = ImageIO.read(file.toFile());
        if(bi == null)
            throw new IOException("No ImageIO reader could decode " + file);
        final RgbRaster ret = new RgbRaster(bi.getHeight(), bi.getWidth());
        for(int r = 0; r < ret.rows; r++) {
            for(int c = 0; c < ret.cols; c++) {
                final int rgb = bi.getRGB(c, r);
                ret.set(r, c, (rgb >> 16) & 0xff, (rgb >> 8) & 0xff, rgb & 0xff);
            }
        }
        return ret;
    }

    private static byte toByte(final double v) {
        final long rounded = Math.round(v);
        return (byte)(rounded < 0 ? 0 : (rounded > 255 ? 255 : rounded));
    }

    private static void doWrite(final BufferedImage ri, final Path file, final String format) throws IOException {
        LOGGER.trace("Writing image {} to {}", ri, file);
        final Iterator<ImageWriter> iter = ImageIO.getImageWritersByFormatName(format);
        IOException last = null;
        int cur = 0;
        while(iter.hasNext()) {
            final ImageWriter writer = iter.next();
            try {
                try(ImageOutputStream ios = ImageIO.createImageOutputStream(file.toFile());) {
                    final ImageWriteParam param = writer.getDefaultWriteParam();
                    writer.setOutput(ios);
                    writer.write(null, new IIOImage(ri, null, null), param);
                }
                return;
            } catch(final IOException ioe) {
                LOGGER.debug("IIO attempt {} using writer {} failed with ", cur, writer, ioe);
                last = ioe;
            } finally {
                writer.dispose();
            }
            cur++;
        }

        if(last != null)
            throw last;
        throw new IOException("No ImageIO writer is available for " + format);
    }
}
