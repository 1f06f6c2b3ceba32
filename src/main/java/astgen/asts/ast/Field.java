package astgen.asts.ast;

import com.google.common.base.Preconditions;

public final class Field {

    public final String name;
    private final AbstractType typ;

    public Field(String name, AbstractType typ) {
        Preconditions.checkArgument(name != null && !name.isEmpty(), "field name must not be empty");
        this.name = name;
        this.typ = Preconditions.checkNotNull(typ, "type of field %s", name);
    }

    public AbstractType getTyp() {
        return typ;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof Field) {
            Field field = (Field) obj;
            return typ.equals(field.typ)
                    && name.equals(field.name);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return name.hashCode() ^ typ.hashCode();
    }

    @Override
    public String toString() {
        return name + ": " + typ;
    }
}
