package com.mongodb.csm.converters;

import com.mongodb.csm.model.OutputFormat;
import picocli.CommandLine;

public class OutputFormatConverter implements CommandLine.ITypeConverter<OutputFormat> {
    @Override
    public OutputFormat convert(String s) throws Exception {
        return OutputFormat.fromValue(s.trim());
    }
}
