package org.dxworks.codeshaper.modify;

public interface ModificationVisitor<R> {

    R visitRename(RenameRequest request);

    R visitAddImport(AddImportRequest request);

    R visitRemoveImport(RemoveImportRequest request);

    R visitAddFunction(AddFunctionRequest request);

    R visitUpdateFunction(UpdateFunctionRequest request);

    R visitAddProperty(AddPropertyRequest request);
}
