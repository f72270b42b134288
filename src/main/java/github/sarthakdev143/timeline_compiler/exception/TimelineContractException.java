package github.sarthakdev143.timeline_compiler.exception;

public class TimelineContractException extends RuntimeException {

    public TimelineContractException(String message) {
        super(message);
    }
}
