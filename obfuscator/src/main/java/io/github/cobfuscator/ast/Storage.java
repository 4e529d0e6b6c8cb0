package io.github.cobfuscator.ast;

public enum Storage {
    NONE(""),
    STATIC("static"),
    EXTERN("extern"),
    REGISTER("register");

    private final String keyword;

    Storage(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }
}
