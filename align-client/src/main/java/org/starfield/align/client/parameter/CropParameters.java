package org.starfield.align.client.parameter;

import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

import java.awt.Rectangle;
import java.io.Serializable;

/**
 * Parameters for the region cropped from every frame before alignment.
 */
public class CropParameters
        implements Serializable {

    @Parameter(
            names = "--crop",
            description = "Region of each frame to align, formatted as x,y,width,height (omit to use entire frames)",
            converter = RectangleConverter.class)
    public Rectangle crop;

    public static class RectangleConverter
            implements IStringConverter<Rectangle> {

        @Override
        public Rectangle convert(final String value) {

            final String[] values = value.split(",");
            if (values.length != 4) {
                throw new ParameterException("crop '" + value + "' must have the form x,y,width,height");
            }

            final int[] ints = new int[4];
            try {
                for (int i = 0; i < values.length; i++) {
                    ints[i] = Integer.parseInt(values[i].trim());
                }
            } catch (final NumberFormatException e) {
                throw new ParameterException("crop '" + value + "' contains a non-integer value", e);
            }

            if ((ints[0] < 0) || (ints[1] < 0) || (ints[2] < 1) || (ints[3] < 1)) {
                throw new ParameterException("crop '" + value + "' must have a non-negative origin and positive size");
            }

            return new Rectangle(ints[0], ints[1], ints[2], ints[3]);
        }
    }

}
