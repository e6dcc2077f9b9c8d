package edu.isi.wdfa;
/** for attempts to combine automata whose alphabets differ */

public class IncompatibleAlphabetException extends Exception {
    /**          Constructs a new exception with null as its detail message. */
    public IncompatibleAlphabetException() { super(); }
    /**      Constructs a new exception with the specified detail message. */
    public IncompatibleAlphabetException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public IncompatibleAlphabetException(String message, Throwable cause) { super(message, cause); }
    /**     Constructs a new exception with the specified cause and a detail message of (cause==null ? null : cause.toString()) (which typically contains the class and detail message of cause). */
    public IncompatibleAlphabetException(Throwable cause) { super(cause); } 
}
