package astgen.targets;

final class Names {

    private Names() {
    }

    static String toFirstLower(String name) {
        return Character.toLowerCase(name.charAt(0)) + name.substring(1);
    }

    static String toFirstUpper(String name) {
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }
}
