package io.backup4j;


public interface TaskHandler<A, R> {
    String name();

    Class<A> argsClass();

    R execute(A args) throws Exception;
}
