package dumb.afsolve;

public enum Label {
    IN, OUT, UNDEC
}
