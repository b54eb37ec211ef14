package com.mongodb.csm.converters;

import com.mongodb.csm.checkpoint.SaveFrequency;
import picocli.CommandLine;

public class SaveFrequencyConverter implements CommandLine.ITypeConverter<SaveFrequency> {
    @Override
    public SaveFrequency convert(String s) throws Exception {
        return SaveFrequency.parse(s.trim());
    }
}
