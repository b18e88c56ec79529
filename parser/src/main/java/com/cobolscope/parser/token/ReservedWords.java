package com.cobolscope.parser.token;

import java.util.Locale;
import java.util.Set;

/**
 * Static reserved-word table used to classify words as keywords, identifiers or division headers.
 * Includes the verbs and operands of the embedded SQL, CICS and MQ sublanguages that the
 * extraction passes key on.
 */
public final class ReservedWords {
    
    private static final Set<String> KEYWORDS = Set.of(
            "ABEND", "ACCEPT", "ACCESS", "ADD", "ADDRESS", "ADVANCING", "AFTER", "ALL", "ALPHABET",
            "ALPHABETIC", "ALPHABETIC-LOWER", "ALPHABETIC-UPPER", "ALPHANUMERIC",
            "ALPHANUMERIC-EDITED", "ALSO", "ALTER", "ALTERNATE", "AND", "ANY", "APPLY", "ARE",
            "AREA", "AREAS", "ASCENDING", "ASKTIME", "ASSIGN", "AT", "AUTHOR", "BASIS", "BEFORE",
            "BEGINNING", "BINARY", "BLANK", "BLOCK", "BOTTOM", "BY", "CALL", "CANCEL", "CBL", "CD",
            "CF", "CH", "CHARACTER", "CHARACTERS", "CLASS", "CLOCK-UNITS", "CLOSE", "COBOL",
            "CODE", "CODE-SET", "COLLATING", "COLUMN", "COMMA", "COMMIT", "COMMON",
            "COMMUNICATION", "COMP", "COMP-1", "COMP-2", "COMP-3", "COMP-4", "COMP-5",
            "COMPUTATIONAL", "COMPUTATIONAL-1", "COMPUTATIONAL-2", "COMPUTATIONAL-3",
            "COMPUTATIONAL-4", "COMPUTATIONAL-5", "COMPUTE",
            "CONFIGURATION", "CONTAINS", "CONTENT", "CONTINUE", "CONTROL", "CONTROLS",
            "CONVERTING", "COPY", "CORR", "CORRESPONDING", "COUNT", "CURRENCY", "CURSOR", "DATA",
            "DATE", "DATE-COMPILED", "DATE-WRITTEN", "DAY", "DAY-OF-WEEK", "DB",
            "DB-ACCESS-CONTROL-KEY", "DB-DATA-NAME", "DB-EXCEPTION", "DB-RECORD-NAME",
            "DB-SET-NAME", "DB-STATUS", "DBCS", "DE", "DEBUG-CONTENTS", "DEBUG-ITEM", "DEBUG-LINE",
            "DEBUG-NAME", "DEBUG-SUB-1", "DEBUG-SUB-2", "DEBUG-SUB-3", "DEBUGGING",
            "DECIMAL-POINT", "DECLARATIVES", "DECLARE", "DELETE", "DELETEQ", "DELIMITED",
            "DELIMITER", "DEPENDING", "DESCENDING", "DESTINATION", "DETAIL", "DISABLE", "DISPLAY",
            "DIVIDE", "DIVISION", "DOWN", "DUPLICATES", "DYNAMIC", "EGI", "ELSE", "EMI", "ENABLE",
            "ENCRYPTION", "END", "END-ADD", "END-CALL", "END-COMPUTE", "END-DELETE", "END-DIVIDE",
            "END-EVALUATE", "END-EXEC", "END-IF", "END-MULTIPLY", "END-OF-PAGE", "END-PERFORM",
            "END-READ", "END-RECEIVE", "END-RETURN", "END-REWRITE", "END-SEARCH", "END-START",
            "END-STRING", "END-SUBTRACT", "END-UNSTRING", "END-WRITE", "ENDBR", "ENDING", "ENTER",
            "ENTRY", "ENVIRONMENT", "EOP", "EQUAL", "ERROR", "ESI", "EVALUATE", "EVERY",
            "EXCEPTION", "EXEC", "EXECUTE", "EXIT", "EXTEND", "EXTERNAL", "FALSE", "FD", "FETCH",
            "FILE", "FILE-CONTROL", "FILLER", "FINAL", "FIRST", "FOOTING", "FOR", "FROM",
            "FUNCTION", "GENERATE", "GIVING", "GLOBAL", "GO", "GOBACK", "GREATER", "GROUP",
            "HANDLE", "HEADING", "HIGH-VALUE", "HIGH-VALUES", "I-O", "I-O-CONTROL", "ID",
            "IDENTIFICATION", "IF", "IN", "INDEX", "INDEXED", "INDICATE", "INITIAL", "INITIALIZE",
            "INITIATE", "INPUT", "INPUT-OUTPUT", "INSERT", "INSPECT", "INSTALLATION", "INTO",
            "INVALID", "INVOKE", "IS", "JUST", "JUSTIFIED", "KEY", "LABEL", "LAST", "LEADING",
            "LEFT", "LENGTH", "LESS", "LIMIT", "LIMITS", "LINAGE", "LINAGE-COUNTER", "LINE",
            "LINE-COUNTER", "LINES", "LINK", "LINKAGE", "LOAD", "LOCAL-STORAGE", "LOCK",
            "LOW-VALUE", "LOW-VALUES", "MAP", "MAPSET", "MEMORY", "MERGE", "MESSAGE", "METACLASS",
            "METHOD", "METHOD-ID", "MODE", "MODULES", "MORE-LABELS", "MOVE", "MQCLOSE", "MQCONN",
            "MQDISC", "MQGET", "MQOPEN", "MQPUT", "MQPUT1", "MULTIPLE", "MULTIPLY", "NATIVE",
            "NEGATIVE", "NEXT", "NO", "NOT", "NULL", "NULLS", "NUMBER", "NUMERIC",
            "NUMERIC-EDITED", "OBJECT", "OBJECT-COMPUTER", "OCCURS", "OF", "OFF", "OMITTED", "ON",
            "OPEN", "OPTIONAL", "OR", "ORDER", "ORGANIZATION", "OTHER", "OUTPUT", "OVERFLOW",
            "OVERRIDE", "PACKED-DECIMAL", "PADDING", "PAGE", "PAGE-COUNTER", "PASSWORD", "PERFORM",
            "PF", "PH", "PIC", "PICTURE", "PLUS", "POINTER", "POSITION", "POSITIVE", "PRINTING",
            "PROCEDURE", "PROCEDURES", "PROCEED", "PROGRAM", "PROGRAM-ID", "PROPERTY", "PROTOTYPE",
            "PURGE", "QNAME", "QUEUE", "QUOTE", "QUOTES", "RANDOM", "RD", "READ", "READNEXT",
            "READPREV", "READQ", "READY", "RECEIVE", "RECORD", "RECORDING", "RECORDS", "RECURSIVE",
            "REDEFINES", "REEL", "REFERENCE", "REFERENCES", "RELATIVE", "RELEASE", "RELOAD",
            "REMAINDER", "REMOVAL", "RENAMES", "REPLACE", "REPLACING", "REPORT", "REPORTING",
            "REPORTS", "REPOSITORY", "RERUN", "RESERVE", "RESET", "RETRIEVE", "RETURN",
            "RETURNING", "REVERSED", "REWIND", "REWRITE", "RF", "RH", "RIGHT", "ROLLBACK",
            "ROUNDED", "RUN", "SAME", "SD", "SEARCH", "SECTION", "SECURITY", "SEGMENT",
            "SEGMENT-LIMIT", "SELECT", "SELF", "SEND", "SENTENCE", "SEPARATE", "SEQUENCE",
            "SEQUENTIAL", "SERVICE", "SET", "SHIFT-IN", "SHIFT-OUT", "SIGN", "SIZE", "SKIP1",
            "SKIP2", "SKIP3", "SORT", "SORT-CONTROL", "SORT-CORE-SIZE", "SORT-FILE-SIZE",
            "SORT-MERGE", "SORT-MESSAGE", "SORT-MODE-SIZE", "SORT-RETURN", "SOURCE",
            "SOURCE-COMPUTER", "SPACE", "SPACES", "SPECIAL-NAMES", "STANDARD", "STANDARD-1",
            "STANDARD-2", "START", "STARTBR", "STATUS", "STOP", "STRING", "SUB-QUEUE-1",
            "SUB-QUEUE-2", "SUB-QUEUE-3", "SUBTRACT", "SUM", "SUPER", "SUPPRESS", "SYMBOLIC",
            "SYNC", "SYNCHRONIZED", "SYNCPOINT", "TABLE", "TALLY", "TALLYING", "TAPE", "TD",
            "TERMINAL", "TERMINATE", "TEST", "TEXT", "THAN", "THEN", "THROUGH", "THRU", "TIME",
            "TIMES", "TITLE", "TO", "TOP", "TRACE", "TRAILING", "TRANSID", "TRUE", "TS", "TYPE",
            "UNIT", "UNSTRING", "UNTIL", "UP", "UPDATE", "UPON", "USAGE", "USE", "USING", "VALUE",
            "VALUES", "VARYING", "WHEN", "WHERE", "WITH", "WORDS", "WORKING-STORAGE", "WRITE",
            "WRITEQ", "XCTL", "ZERO", "ZEROES", "ZEROS"
    );
    
    private static final Set<String> DIVISIONS = Set.of("IDENTIFICATION", "ENVIRONMENT", "DATA", "PROCEDURE");
    
    private ReservedWords() {
    }
    
    public static boolean isKeyword(String word) {
        return KEYWORDS.contains(word.toUpperCase(Locale.ROOT));
    }
    
    public static boolean isDivision(String word) {
        return DIVISIONS.contains(word.toUpperCase(Locale.ROOT));
    }
    
    public static int size() {
        return KEYWORDS.size();
    }
}
