package com.mongodb.csm.converters;

import com.mongodb.csm.model.FullDocumentMode;
import picocli.CommandLine;

public class FullDocumentModeConverter implements CommandLine.ITypeConverter<FullDocumentMode> {
    @Override
    public FullDocumentMode convert(String s) throws Exception {
        return FullDocumentMode.fromValue(s.trim());
    }
}
