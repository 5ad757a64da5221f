package typesafeschwalbe.patcan.can;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import typesafeschwalbe.patcan.compiler.IdentIds;
import typesafeschwalbe.patcan.compiler.Interns;
import typesafeschwalbe.patcan.compiler.Namespace;
import typesafeschwalbe.patcan.compiler.Symbol;

public class Env {

    private static final Logger LOGGER = Logger.getLogger(Env.class.getName());

    public final Namespace home;
    public final Interns interns;
    private final List<Problem> problems;

    public Env(Namespace home, Interns interns) {
        this.home = home;
        this.interns = interns;
        this.problems = new ArrayList<>();
    }

    public Env(Namespace home) {
        this(home, new Interns());
    }

    public IdentIds identIds() {
        return this.interns.identIds(this.home);
    }

    public Symbol intern(String name) {
        return this.interns.intern(this.home, name);
    }

    public void problem(Problem problem) {
        if(LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(
                "problem in module '" + this.home + "': " + problem
            );
        }
        this.problems.add(problem);
    }

    public List<Problem> problems() {
        return Collections.unmodifiableList(this.problems);
    }

}
