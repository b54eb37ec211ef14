package com.mongodb.csm.converters;

import com.mongodb.csm.model.OperationKind;
import picocli.CommandLine;

public class OperationKindConverter implements CommandLine.ITypeConverter<OperationKind> {
    @Override
    public OperationKind convert(String s) throws Exception {
        return OperationKind.fromValue(s.trim());
    }
}
