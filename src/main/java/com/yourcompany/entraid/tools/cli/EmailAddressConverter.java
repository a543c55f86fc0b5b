package com.yourcompany.entraid.tools.cli;

import java.util.regex.Pattern;

import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

/**
 * Accepts {@code local@domain.tld} shaped values only.
 */
public class EmailAddressConverter implements ITypeConverter<String> {

    static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    @Override
    public String convert(String value) {
        if (!EMAIL.matcher(value).matches()) {
            throw new TypeConversionException("Invalid email address: '" + value + "'");
        }
        return value;
    }
}
