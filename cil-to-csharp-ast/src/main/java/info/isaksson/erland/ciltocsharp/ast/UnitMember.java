package info.isaksson.erland.ciltocsharp.ast;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/** A declaration directly under the compilation unit: a namespace or a namespace-less type. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "node")
@JsonSubTypes({
        @JsonSubTypes.Type(value = NamespaceDeclaration.class, name = "namespace"),
        @JsonSubTypes.Type(value = TypeDeclaration.class, name = "type")
})
public interface UnitMember {

    String name();
}
