package info.isaksson.erland.ciltocsharp.ast;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A class, struct, interface or enum.
 *
 * <p>{@link #members} holds nested types first, then fields, events, properties, constructors
 * and methods.</p>
 */
@JsonTypeName("type")
@JsonPropertyOrder({"name","classType","modifiers","baseTypes","members"})
public final class TypeDeclaration implements UnitMember, MemberDeclaration {
    public final String name;
    public final ClassType classType;
    public final Set<Modifier> modifiers;
    public final List<TypeExpression> baseTypes;
    public final List<MemberDeclaration> members;

    public TypeDeclaration(String name, ClassType classType, Set<Modifier> modifiers,
                           List<TypeExpression> baseTypes, List<MemberDeclaration> members) {
        this.name = Objects.requireNonNull(name, "name");
        this.classType = classType == null ? ClassType.CLASS : classType;
        this.modifiers = Modifiers.copyOf(modifiers);
        this.baseTypes = baseTypes == null ? List.of() : List.copyOf(baseTypes);
        this.members = members == null ? List.of() : List.copyOf(members);
    }

    public TypeDeclaration withMembers(List<MemberDeclaration> newMembers) {
        return new TypeDeclaration(name, classType, modifiers, baseTypes, newMembers);
    }

    public TypeDeclaration withBaseTypes(List<TypeExpression> newBaseTypes) {
        return new TypeDeclaration(name, classType, modifiers, newBaseTypes, members);
    }

    /** Members of one category, in order. */
    public List<MemberDeclaration> membersOfKind(MemberKind kind) {
        List<MemberDeclaration> out = new ArrayList<>();
        for (MemberDeclaration m : members) {
            if (m.memberKind() == kind) out.add(m);
        }
        return out;
    }

    @Override public MemberKind memberKind() { return MemberKind.NESTED_TYPE; }
    @Override public String name() { return name; }
    @Override public Set<Modifier> modifiers() { return modifiers; }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeDeclaration)) return false;
        TypeDeclaration that = (TypeDeclaration) o;
        return name.equals(that.name) &&
                classType == that.classType &&
                modifiers.equals(that.modifiers) &&
                baseTypes.equals(that.baseTypes) &&
                members.equals(that.members);
    }

    @Override public int hashCode() {
        return Objects.hash(name, classType, modifiers, baseTypes, members);
    }

    @Override public String toString() {
        return classType.keyword() + " " + name;
    }
}
