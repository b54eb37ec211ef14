package com.mongodb.csm.converters;

import com.mongodb.csm.model.ConnectionTarget;
import picocli.CommandLine;

public class ConnectionTargetConverter implements CommandLine.ITypeConverter<ConnectionTarget> {
    @Override
    public ConnectionTarget convert(String s) throws Exception {
        return ConnectionTarget.of(s);
    }
}
