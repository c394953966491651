package org.dxworks.codeshaper.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ClassInfo {
    public final String name;
    public final String superclassName;
    public final List<MethodInfo> methods;
    public final int line;
    public final boolean exported;  // declared inside an export statement
    public final boolean topLevel;

    public ClassInfo(String name, String superclassName, List<MethodInfo> methods, int line,
                     boolean exported, boolean topLevel) {
        this.name = name;
        this.superclassName = superclassName;
        this.methods = List.copyOf(methods);
        this.line = line;
        this.exported = exported;
        this.topLevel = topLevel;
    }
}
