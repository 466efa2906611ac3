package com.teamsbot.meeting;

/**
 * JavaScript injected into the Teams web client.
 */
final class TeamsPageScripts {

    private TeamsPageScripts() {
    }

    /**
     * Hides the automation flags Teams checks for.
     */
    static final String STEALTH = """
            () => {
              Object.defineProperty(navigator, 'webdriver', { get: () => undefined });
              window.chrome = { runtime: {} };
              Object.defineProperty(navigator, 'languages', { get: () => ['en-US', 'en'] });
            }
            """;

    /**
     * Taps every remote audio track of every RTCPeerConnection, mixes them down to mono and
     * resamples to the requested rate. Chunks are queued as base64 little-endian 16-bit PCM in
     * {@code window.__teamsBot.audio} until the next drain.
     */
    static String audioCapture(int sampleRate) {
        return """
                (() => {
                  const bot = window.__teamsBot = { audio: [], tracks: 0 };
                  let ctx = null;
                  let mixer = null;

                  const encode = (samples) => {
                    const pcm = new Int16Array(samples.length);
                    for (let i = 0; i < samples.length; i++) {
                      const s = Math.max(-1, Math.min(1, samples[i]));
                      pcm[i] = s < 0 ? s * 0x8000 : s * 0x7fff;
                    }
                    const bytes = new Uint8Array(pcm.buffer);
                    let binary = '';
                    for (let i = 0; i < bytes.length; i++) {
                      binary += String.fromCharCode(bytes[i]);
                    }
                    return btoa(binary);
                  };

                  const ensureMixer = () => {
                    if (mixer) return mixer;
                    ctx = new AudioContext({ sampleRate: %d });
                    mixer = ctx.createGain();
                    const processor = ctx.createScriptProcessor(4096, 1, 1);
                    processor.onaudioprocess = (e) => {
                      if (bot.audio.length < 2000) {
                        bot.audio.push(encode(e.inputBuffer.getChannelData(0)));
                      }
                    };
                    mixer.connect(processor);
                    processor.connect(ctx.destination);
                    return mixer;
                  };

                  const Native = window.RTCPeerConnection;
                  window.RTCPeerConnection = function (...args) {
                    const pc = new Native(...args);
                    pc.addEventListener('track', (event) => {
                      if (event.track.kind !== 'audio') return;
                      const stream = event.streams[0] || new MediaStream([event.track]);
                      ctx || ensureMixer();
                      ctx.createMediaStreamSource(stream).connect(ensureMixer());
                      bot.tracks++;
                    });
                    return pc;
                  };
                  window.RTCPeerConnection.prototype = Native.prototype;
                })();
                """.formatted(sampleRate);
    }

    /**
     * Empties the audio queue and reads the roster and the active speaker. Returns JSON.
     */
    static final String DRAIN = """
            (() => {
              const bot = window.__teamsBot || { audio: [] };
              const audio = bot.audio.splice(0, bot.audio.length);

              const participants = [];
              document.querySelectorAll('[data-tid^="participant-item-"], [data-cid="roster-participant"]').forEach((el) => {
                const name = (el.getAttribute('aria-label') || el.innerText || '').split('\\n')[0].trim();
                const id = el.getAttribute('data-tid') || el.getAttribute('id') || name;
                if (name) participants.push({ id: id, name: name });
              });

              let speakerId = null;
              let speakerName = null;
              const speaking = document.querySelector('[data-is-speaking="true"], [data-tid="voice-level-stream-outline"][data-speaking="true"]');
              if (speaking) {
                const tile = speaking.closest('[data-tid][aria-label]') || speaking;
                speakerName = (tile.getAttribute('aria-label') || '').split(',')[0].trim() || null;
                speakerId = tile.getAttribute('data-participant-id') || tile.getAttribute('data-tid') || speakerName;
              }

              return JSON.stringify({ audio: audio, speakerId: speakerId, speakerName: speakerName, participants: participants });
            })()
            """;

    static final String CLICK_LEAVE = """
            (() => {
              const btn = document.querySelector('[data-tid="hangup-main-btn"]') ||
                          document.querySelector('[data-tid="hangup-button"]') ||
                          document.querySelector('button[aria-label*="Leave" i]');
              if (btn) { btn.click(); return 'clicked'; }
              for (const b of document.querySelectorAll('button')) {
                if ((b.innerText || '').trim().toLowerCase() === 'leave') { b.click(); return 'clicked-alt'; }
              }
              return 'not-found';
            })()
            """;
}
