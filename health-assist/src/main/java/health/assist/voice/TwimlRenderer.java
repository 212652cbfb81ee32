package health.assist.voice;

import com.twilio.http.HttpMethod;
import com.twilio.twiml.VoiceResponse;
import com.twilio.twiml.voice.Gather;
import com.twilio.twiml.voice.Hangup;
import com.twilio.twiml.voice.Pause;
import com.twilio.twiml.voice.Say;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class TwimlRenderer {
    static final int GATHER_TIMEOUT_SECONDS = 60;

    public String reminder(ReminderScript script, String gatherActionUrl) {
        Gather gather = new Gather.Builder()
                .inputs(List.of(Gather.Input.SPEECH, Gather.Input.DTMF))
                .timeout(GATHER_TIMEOUT_SECONDS)
                .speechTimeout("auto")
                .action(gatherActionUrl)
                .method(HttpMethod.POST)
                .say(say(script.intro()))
                .pause(pause())
                .say(say("Please say yes if you took your medicine. "
                        + "If you do not respond within one minute, this dose will be marked as missed."))
                .build();

        return new VoiceResponse.Builder()
                .gather(gather)
                .say(say("No response received. This reminder is marked as missed. Take care."))
                .hangup(new Hangup.Builder().build())
                .build()
                .toXml();
    }

    public String gatherAcknowledgement(CallResponse response) {
        VoiceResponse.Builder twiml = new VoiceResponse.Builder();
        if (response == CallResponse.TAKEN) {
            twiml.say(say("Thank you. Your response has been recorded as taken. Stay healthy."));
        } else {
            twiml.say(say("No valid yes response detected. This reminder is marked as missed."))
                    .pause(pause())
                    .say(say("Please take your medicine as soon as possible or contact your caregiver."));
        }
        return twiml.hangup(new Hangup.Builder().build()).build().toXml();
    }

    private static Say say(String text) {
        return new Say.Builder(text)
                .voice(Say.Voice.ALICE)
                .language(Say.Language.EN_IN)
                .build();
    }

    private static Pause pause() {
        return new Pause.Builder().length(1).build();
    }
}
