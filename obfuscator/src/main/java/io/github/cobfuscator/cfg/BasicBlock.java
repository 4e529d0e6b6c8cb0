package io.github.cobfuscator.cfg;

import io.github.cobfuscator.ast.Stmt;

import java.util.ArrayList;
import java.util.List;

public class BasicBlock {

    private final int id;
    private final List<Stmt> statements;
    private Terminator terminator;

    public BasicBlock(int id) {
        this(id, new ArrayList<>(), null);
    }

    public BasicBlock(int id, List<Stmt> statements, Terminator terminator) {
        this.id = id;
        this.statements = statements;
        this.terminator = terminator;
    }

    public int getId() {
        return id;
    }

    public List<Stmt> getStatements() {
        return statements;
    }

    public Terminator getTerminator() {
        return terminator;
    }

    void add(Stmt statement) {
        statements.add(statement);
    }

    void terminate(Terminator terminator) {
        this.terminator = terminator;
    }

    public boolean isEmptyFallthrough() {
        return statements.isEmpty() && terminator instanceof Terminator.Fallthrough;
    }

    @Override
    public String toString() {
        return "B" + id + "[" + statements.size() + " stmts, " + terminator + "]";
    }
}
