package com.mongodb.csm.converters;

import com.mongodb.csm.model.WatchScope;
import picocli.CommandLine;

public class WatchScopeConverter implements CommandLine.ITypeConverter<WatchScope> {
    @Override
    public WatchScope convert(String s) throws Exception {
        return WatchScope.fromValue(s.trim());
    }
}
