package info.isaksson.erland.ciltocsharp.ast;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Set;

/** A declaration owned by a type. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "node")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TypeDeclaration.class, name = "type"),
        @JsonSubTypes.Type(value = FieldDeclaration.class, name = "field"),
        @JsonSubTypes.Type(value = EventDeclaration.class, name = "event"),
        @JsonSubTypes.Type(value = PropertyDeclaration.class, name = "property"),
        @JsonSubTypes.Type(value = ConstructorDeclaration.class, name = "constructor"),
        @JsonSubTypes.Type(value = MethodDeclaration.class, name = "method")
})
public interface MemberDeclaration {

    MemberKind memberKind();

    String name();

    Set<Modifier> modifiers();
}
