package imgpack.commands;

import imgpack.models.*;
import picocli.CommandLine.*;

// Accepts webp, jpg, jpeg, png and gif in any case.
public class TargetFormatConverter implements ITypeConverter<TargetFormat> {
    @Override
    public TargetFormat convert(String value) {
        try {
            return TargetFormat.parse(value);
        } catch (IllegalArgumentException e) {
            throw new TypeConversionException(e.getMessage());
        }
    }
}
